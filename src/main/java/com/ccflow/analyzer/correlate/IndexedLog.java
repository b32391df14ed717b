package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.LogEntry;
import lombok.Value;

/**
 * 日志 + 它在输入序列里的位置，节点 ID 要用到位置。
 */
@Value
public class IndexedLog {
    int index;
    LogEntry log;
}
