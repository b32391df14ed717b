package com.ccflow.analyzer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * X-Ray 原始 trace 文档里的一个节点（segment 或 subsegment），按收到的样子保存。
 * children 对应文档里的 subsegments。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Segment {

    private String id;
    private String name;
    private double startTime;
    private double endTime;
    private String parentId;

    /** aws / remote / null */
    private String namespace;
    private String origin;

    private String awsOperation;
    private List<String> awsResourceNames;
    private String awsTableName;

    private HttpCall http;

    /** cause.exceptions[...]，原样保留 */
    private JsonNode cause;

    private boolean error;
    private boolean fault;
    private boolean throttle;

    @Builder.Default
    private List<Segment> children = new ArrayList<>();

    /** 去掉 children 的副本，放进图节点时用，避免整棵子树被重复序列化 */
    public Segment withoutChildren() {
        return toBuilder().children(new ArrayList<>()).build();
    }
}
