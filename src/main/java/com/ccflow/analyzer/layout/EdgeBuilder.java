package com.ccflow.analyzer.layout;

import com.ccflow.analyzer.model.GraphEdge;
import com.ccflow.analyzer.model.GraphNode;
import com.ccflow.analyzer.model.GraphPayload;
import com.ccflow.analyzer.model.HttpCall;
import com.ccflow.analyzer.model.Port;
import com.ccflow.analyzer.model.ResolvedTraceNode;
import com.ccflow.analyzer.model.Segment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 连线：
 * - 日志节点：相邻节点 i -> i+1，挂点用布局算好的
 * - trace 节点：resolvedParentId -> 节点，标签取 AWS 操作 / HTTP 方法+路径 / 段名
 */
@Slf4j
public class EdgeBuilder {

    public List<GraphEdge> buildEdges(List<GraphNode> positioned) {
        if (positioned == null || positioned.isEmpty()) {
            return List.of();
        }
        boolean trace = positioned.stream().anyMatch(n -> n.getPayload() instanceof ResolvedTraceNode);
        return trace ? buildCausalEdges(positioned) : buildSequentialEdges(positioned);
    }

    public List<GraphEdge> buildSequentialEdges(List<GraphNode> positioned) {
        List<GraphEdge> edges = new ArrayList<>();
        for (int i = 0; i + 1 < positioned.size(); i++) {
            GraphNode from = positioned.get(i);
            GraphNode to = positioned.get(i + 1);
            edges.add(GraphEdge.builder()
                    .id("edge_" + i + "_" + (i + 1))
                    .source(from.getId())
                    .target(to.getId())
                    .sourcePort(from.getSourcePort())
                    .targetPort(to.getTargetPort())
                    .label(String.valueOf(i + 1))
                    .errorPath(hasError(from) || hasError(to))
                    .build());
        }
        return edges;
    }

    public List<GraphEdge> buildCausalEdges(List<GraphNode> positioned) {
        Map<String, GraphNode> byId = new HashMap<>();
        String rootId = null;
        for (GraphNode node : positioned) {
            byId.putIfAbsent(node.getId(), node);
            if (rootId == null && node.getPayload() instanceof ResolvedTraceNode t && t.isRoot()) {
                rootId = node.getId();
            }
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (GraphNode node : positioned) {
            if (!(node.getPayload() instanceof ResolvedTraceNode traceNode) || traceNode.isRoot()) {
                continue;
            }
            String source = traceNode.getResolvedParentId();
            if (!byId.containsKey(source)) {
                if (rootId == null) {
                    log.debug("Drop edge without parent node: target={}, parent={}", node.getId(), source);
                    continue;
                }
                source = rootId;
            }

            Segment segment = traceNode.getSegment();
            String label = edgeLabel(segment);
            String secondary = secondaryLabel(segment);
            if (secondary != null) {
                label = label + "\n" + secondary;
            }

            edges.add(GraphEdge.builder()
                    .id(source + "-" + node.getId())
                    .source(source)
                    .target(node.getId())
                    .sourcePort(portOr(byId.get(source).getSourcePort(), Port.RIGHT))
                    .targetPort(portOr(node.getTargetPort(), Port.LEFT))
                    .label(label)
                    .errorPath(traceNode.hasError() || secondary != null)
                    .build());
        }
        return edges;
    }

    /**
     * 主标签：AWS 操作名；有 HTTP 请求时是 “方法\n路径”；否则段名。
     */
    public static String edgeLabel(Segment segment) {
        if (segment == null) {
            return "";
        }
        if (segment.getAwsOperation() != null) {
            return segment.getAwsOperation();
        }
        String name = segment.getName() == null ? "" : segment.getName();
        HttpCall http = segment.getHttp();
        String url = http == null || http.getUrl() == null ? "" : http.getUrl();
        if (!url.isEmpty()) {
            String method = http.getMethod() == null ? "" : http.getMethod();
            return method + "\n" + pathOf(url);
        }
        return name;
    }

    /**
     * 附加标签：非 2xx 响应码，或异常信息。有附加标签的连线按错误路径画。
     */
    public static String secondaryLabel(Segment segment) {
        if (segment == null) {
            return null;
        }
        HttpCall http = segment.getHttp();
        if (http != null && http.getStatus() != null && (http.getStatus() < 200 || http.getStatus() >= 300)) {
            return String.valueOf(http.getStatus());
        }

        JsonNode cause = segment.getCause();
        if (cause == null || cause.isNull() || cause.isMissingNode()) {
            return null;
        }
        JsonNode exceptions = cause.path("exceptions");
        if (exceptions.isArray() && !exceptions.isEmpty()) {
            String message = exceptions.get(0).path("message").asText(null);
            if (message != null && !message.isBlank()) {
                return message;
            }
        }
        String message = cause.path("message").asText(null);
        if (message != null && !message.isBlank()) {
            return message;
        }
        return "Exception";
    }

    // 去掉 scheme + host：按 / 切开，第三段之后的部分
    static String pathOf(String url) {
        String[] parts = url.split("/", -1);
        if (parts.length <= 3) {
            return url;
        }
        return String.join("/", Arrays.copyOfRange(parts, 3, parts.length));
    }

    // 没有布局挂点（泳道布局的根、网格末尾节点）时按左进右出
    private static Port portOr(Port port, Port fallback) {
        return port == null ? fallback : port;
    }

    private static boolean hasError(GraphNode node) {
        GraphPayload payload = node.getPayload();
        return payload != null && payload.hasError();
    }
}
