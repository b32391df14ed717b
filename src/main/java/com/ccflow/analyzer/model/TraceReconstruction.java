package com.ccflow.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * trace 重建结果。nodes 不含根节点，按遍历顺序排列；lanes 按服务分组，保持首次出现顺序。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TraceReconstruction {
    private ResolvedTraceNode root;
    private List<ResolvedTraceNode> nodes = new ArrayList<>();
    private Map<String, List<ResolvedTraceNode>> lanes = new LinkedHashMap<>();
    private List<Diagnosis> diagnoses = new ArrayList<>();
}
