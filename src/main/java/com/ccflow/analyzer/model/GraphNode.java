package com.ccflow.analyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphNode {
    private String id;
    private Position position;
    private Port sourcePort;
    private Port targetPort;
    private GraphPayload payload;
}
