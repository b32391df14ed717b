package com.ccflow.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 一个或多个连续日志合并后的可视化单元。
 *
 * parameters：单条时就是该日志的 Parameters；多条合并时是按顺序排列的数组。
 * results / timestamp：取最后一条。
 * sourceLogs：全部成员日志，子流程节点下钻时使用。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsolidatedNode implements GraphPayload {

    private String id;
    private String moduleType;
    private String label;
    private String flowName;
    private String identifier;
    private Instant timestamp;

    private JsonNode parameters;
    private String results;
    private JsonNode externalResults;

    /** 页脚展示用，单条和多条分组保持一致 */
    private String footerResults;
    private JsonNode footerExternalResults;

    @JsonProperty("isError")
    private boolean error;

    /** 子流程（MOD_）折叠出来的模块节点 */
    private boolean moduleNode;

    private TimeRange timeRange;
    private int memberCount;
    private List<LogEntry> sourceLogs;

    @Override
    public String nodeId() {
        return id;
    }

    @Override
    public boolean hasError() {
        return error;
    }
}
