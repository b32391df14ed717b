package com.ccflow.analyzer.model;

import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class GraphSummary {
    private int inputCount;          // 原始日志条数 / trace 节点数
    private int nodeCount;
    private int edgeCount;
    private int errorCount;          // 按原始输入统计，不按合并后的节点
    private Instant startTime;
    private Instant endTime;
    private List<String> operations; // trace 图才有：Operation 1: GetItem table ...
}
