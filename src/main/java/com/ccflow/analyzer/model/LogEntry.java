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
 * 一条 Amazon Connect 联络流执行日志（CloudWatch 导出的 JSON 记录）。
 * 字段名保持 CloudWatch 原样（PascalCase），方便直接读写导出文件。
 *
 * 进入分组流水线之后不再修改。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogEntry {

    @JsonProperty("Timestamp")
    private Instant timestamp;

    @JsonProperty("ContactId")
    private String contactId;

    @JsonProperty("ContactFlowId")
    private String flowId;

    @JsonProperty("ContactFlowName")
    private String flowName;

    /** SetAttributes / GetUserInput / InvokeExternalResource ... */
    @JsonProperty("ContactFlowModuleType")
    private String moduleType;

    /** 流程块 ID，同一个块重复执行时保持不变 */
    @JsonProperty("Identifier")
    private String identifier;

    @JsonProperty("Parameters")
    private JsonNode parameters;

    @JsonProperty("Results")
    private String results;

    /** Lambda / 外部资源的返回，isSuccess 为字符串 "true" / "false" */
    @JsonProperty("ExternalResults")
    private JsonNode externalResults;

    @JsonProperty("ModuleExecutionStack")
    private List<String> moduleExecutionStack;
}
