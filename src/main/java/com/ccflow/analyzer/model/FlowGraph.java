package com.ccflow.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 导出文件的结构就是 {nodes, edges}，字段名不要改，老的导出文件还要能读回来。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlowGraph {
    private List<GraphNode> nodes = new ArrayList<>();
    private List<GraphEdge> edges = new ArrayList<>();
}
