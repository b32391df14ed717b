package com.ccflow.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析后的一条 trace：已经嵌套好的根 segment + 解析时的诊断。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TraceDocument {
    private String traceId;
    private Segment root;
    private List<Diagnosis> diagnoses = new ArrayList<>();
}
