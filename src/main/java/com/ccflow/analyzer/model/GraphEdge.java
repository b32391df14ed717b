package com.ccflow.analyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphEdge {
    private String id;
    private String source;
    private String target;
    private Port sourcePort;
    private Port targetPort;
    private String label;

    @JsonProperty("isErrorPath")
    private boolean errorPath;
}
