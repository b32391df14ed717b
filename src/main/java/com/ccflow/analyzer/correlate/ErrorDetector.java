package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.LogEntry;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 判断一条日志是否出错：Results 里包含错误关键字（区分大小写的子串匹配），
 * 或 ExternalResults.isSuccess == "false"。
 *
 * 子串匹配会误报，比如客户输入的 "no Error found"，这里保持原有判定口径。
 */
public class ErrorDetector {

    private final List<String> keywords;

    public ErrorDetector(List<String> keywords) {
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean isError(LogEntry log) {
        if (log == null) {
            return false;
        }
        return containsKeyword(log.getResults()) || externalFailed(log.getExternalResults());
    }

    public boolean anyError(List<LogEntry> logs) {
        return logs.stream().anyMatch(this::isError);
    }

    boolean containsKeyword(String results) {
        if (results == null || results.isEmpty()) {
            return false;
        }
        for (String keyword : keywords) {
            if (results.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private boolean externalFailed(JsonNode externalResults) {
        if (externalResults == null || !externalResults.isObject()) {
            return false;
        }
        JsonNode isSuccess = externalResults.get("isSuccess");
        return isSuccess != null && isSuccess.isTextual() && "false".equals(isSuccess.textValue());
    }
}
