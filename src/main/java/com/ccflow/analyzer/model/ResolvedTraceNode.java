package com.ccflow.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重建后的 trace 节点。
 *
 * resolvedParentId 只会指向另一个 ResolvedTraceNode 或 trace 根节点，不会指向 Invocation / Attempt 这类包装节点。
 * 根节点本身的 resolvedParentId 为 null。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResolvedTraceNode implements GraphPayload {

    private Segment segment;
    private String resolvedParentId;
    private int depth;

    /** 服务泳道：DynamoDB / HTTP / 段名 ... */
    private String serviceKey;

    public static ResolvedTraceNode root(Segment root, String serviceKey) {
        return ResolvedTraceNode.builder()
                .segment(root.withoutChildren())
                .resolvedParentId(null)
                .depth(0)
                .serviceKey(serviceKey)
                .build();
    }

    @JsonIgnore
    public boolean isRoot() {
        return resolvedParentId == null;
    }

    @Override
    public String nodeId() {
        return segment == null ? null : segment.getId();
    }

    @Override
    public boolean hasError() {
        return segment != null && (segment.isError() || segment.isFault());
    }
}
