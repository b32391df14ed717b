package com.ccflow.analyzer.model;

import lombok.Data;

import java.util.List;

/**
 * 接口返回：
 * {
 *   graph: {nodes, edges},
 *   summary: ...,
 *   diagnoses: [...]
 * }
 */
@Data
public class AnalyzeResult {
    private FlowGraph graph;
    private GraphSummary summary;
    private List<Diagnosis> diagnoses;
}
