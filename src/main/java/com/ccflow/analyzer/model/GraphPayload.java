package com.ccflow.analyzer.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 图节点承载的数据：日志节点或 trace 节点。
 * 布局和连线阶段只通过这个接口看节点，不关心具体内容。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConsolidatedNode.class, name = "log"),
        @JsonSubTypes.Type(value = ResolvedTraceNode.class, name = "trace")
})
public interface GraphPayload {

    String nodeId();

    boolean hasError();
}
