package com.ccflow.analyzer.parser;

import com.ccflow.analyzer.model.Diagnosis;
import com.ccflow.analyzer.model.LogEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析出来的日志（已按时间排序）+ 跳过的行。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParsedLogs {
    private List<LogEntry> logs = new ArrayList<>();
    private List<Diagnosis> diagnoses = new ArrayList<>();
}
