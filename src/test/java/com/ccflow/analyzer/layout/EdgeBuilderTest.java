package com.ccflow.analyzer.layout;

import com.ccflow.analyzer.model.ConsolidatedNode;
import com.ccflow.analyzer.model.GraphEdge;
import com.ccflow.analyzer.model.GraphNode;
import com.ccflow.analyzer.model.HttpCall;
import com.ccflow.analyzer.model.Port;
import com.ccflow.analyzer.model.ResolvedTraceNode;
import com.ccflow.analyzer.model.Segment;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EdgeBuilderTest {

    private final EdgeBuilder edgeBuilder = new EdgeBuilder();
    private final GraphLayoutEngine engine = new GraphLayoutEngine();

    @Test
    void sequentialEdgesLinkNeighboursWithLayoutPorts() {
        List<ConsolidatedNode> nodes = List.of(
                ConsolidatedNode.builder().id("a").build(),
                ConsolidatedNode.builder().id("b").error(true).build(),
                ConsolidatedNode.builder().id("c").build(),
                ConsolidatedNode.builder().id("d").build());
        List<GraphNode> positioned = engine.layoutNodes(nodes, GridConfig.ofColumns(2));

        List<GraphEdge> edges = edgeBuilder.buildEdges(positioned);

        assertThat(edges).extracting(GraphEdge::getId).containsExactly("edge_0_1", "edge_1_2", "edge_2_3");
        assertThat(edges).extracting(GraphEdge::getSource).containsExactly("a", "b", "c");
        assertThat(edges).extracting(GraphEdge::isErrorPath).containsExactly(true, true, false);
        assertThat(edges.get(1).getSourcePort()).isEqualTo(Port.BOTTOM);
        assertThat(edges.get(1).getTargetPort()).isEqualTo(Port.TOP);
        assertThat(edges.get(2).getSourcePort()).isEqualTo(Port.LEFT);
        assertThat(edges.get(2).getTargetPort()).isEqualTo(Port.RIGHT);
        assertThat(edges).extracting(GraphEdge::getLabel).containsExactly("1", "2", "3");
    }

    @Test
    void causalEdgesUseAwsOperationLabel() {
        List<GraphNode> positioned = traceGraph(child("d1", "root",
                Segment.builder().id("d1").name("DynamoDB").namespace("aws").awsOperation("GetItem").build()));

        List<GraphEdge> edges = edgeBuilder.buildEdges(positioned);

        assertThat(edges).hasSize(1);
        GraphEdge edge = edges.get(0);
        assertThat(edge.getId()).isEqualTo("root-d1");
        assertThat(edge.getSource()).isEqualTo("root");
        assertThat(edge.getTarget()).isEqualTo("d1");
        assertThat(edge.getLabel()).isEqualTo("GetItem");
        assertThat(edge.isErrorPath()).isFalse();
        assertThat(edge.getSourcePort()).isEqualTo(Port.RIGHT);
        assertThat(edge.getTargetPort()).isEqualTo(Port.LEFT);
    }

    @Test
    void httpCallsGetMethodPathAndFailingStatus() {
        Segment call = Segment.builder().id("h1").name("api.example.com")
                .http(HttpCall.builder().method("POST").url("https://api.example.com/v1/orders?x=1").status(503).build())
                .build();

        GraphEdge edge = edgeBuilder.buildEdges(traceGraph(child("h1", "root", call))).get(0);

        assertThat(edge.getLabel()).isEqualTo("POST\nv1/orders?x=1\n503");
        assertThat(edge.isErrorPath()).isTrue();
    }

    @Test
    void dottedNameWithoutHttpKeepsSegmentName() {
        Segment handler = Segment.builder().id("d1").name("DynamoDB.GetItem").build();

        assertThat(EdgeBuilder.edgeLabel(handler)).isEqualTo("DynamoDB.GetItem");
        GraphEdge edge = edgeBuilder.buildEdges(traceGraph(child("d1", "root", handler))).get(0);
        assertThat(edge.getLabel()).isEqualTo("DynamoDB.GetItem");
        assertThat(edge.isErrorPath()).isFalse();
    }

    @Test
    void gridTraceEdgesFollowZigzagPorts() {
        ResolvedTraceNode[] children = new ResolvedTraceNode[6];
        for (int i = 0; i < children.length; i++) {
            String id = "w" + (i + 1);
            children[i] = child(id, "root", Segment.builder().id(id).name("worker").build());
        }

        List<GraphEdge> edges = edgeBuilder.buildEdges(traceGraph(children));

        assertThat(edges).hasSize(6);
        assertThat(edges).allSatisfy(e -> assertThat(e.getSourcePort()).isEqualTo(Port.RIGHT));
        assertThat(edges.get(3).getTarget()).isEqualTo("w4");
        assertThat(edges.get(3).getTargetPort()).isEqualTo(Port.LEFT);
        assertThat(edges.get(4).getTarget()).isEqualTo("w5");
        assertThat(edges.get(4).getTargetPort()).isEqualTo(Port.TOP);
        assertThat(edges.get(5).getTargetPort()).isEqualTo(Port.RIGHT);
    }

    @Test
    void successfulHttpStatusAddsNoSecondaryLabel() {
        Segment call = Segment.builder().id("h1").name("svc")
                .http(HttpCall.builder().method("GET").url("https://svc/health").status(204).build())
                .build();

        GraphEdge edge = edgeBuilder.buildEdges(traceGraph(child("h1", "root", call))).get(0);

        assertThat(edge.getLabel()).isEqualTo("GET\nhealth");
        assertThat(edge.isErrorPath()).isFalse();
    }

    @Test
    void exceptionCauseFlipsErrorStyle() {
        ObjectNode cause = JsonNodeFactory.instance.objectNode();
        cause.putArray("exceptions").addObject().put("message", "Connection reset");
        Segment worker = Segment.builder().id("w1").name("worker").cause(cause).build();

        GraphEdge edge = edgeBuilder.buildEdges(traceGraph(child("w1", "root", worker))).get(0);

        assertThat(edge.getLabel()).isEqualTo("worker\nConnection reset");
        assertThat(edge.isErrorPath()).isTrue();
    }

    @Test
    void unknownParentFallsBackToRoot() {
        Segment worker = Segment.builder().id("w1").name("worker").build();

        GraphEdge edge = edgeBuilder.buildEdges(traceGraph(child("w1", "ghost", worker))).get(0);

        assertThat(edge.getSource()).isEqualTo("root");
    }

    @Test
    void faultedChildMarksErrorPath() {
        Segment worker = Segment.builder().id("w1").name("worker").fault(true).build();

        GraphEdge edge = edgeBuilder.buildEdges(traceGraph(child("w1", "root", worker))).get(0);

        assertThat(edge.getLabel()).isEqualTo("worker");
        assertThat(edge.isErrorPath()).isTrue();
    }

    @Test
    void pathKeepsWholeUrlWhenThereIsNoHost() {
        assertThat(EdgeBuilder.pathOf("relative/path")).isEqualTo("relative/path");
        assertThat(EdgeBuilder.pathOf("https://host/a/b")).isEqualTo("a/b");
        assertThat(EdgeBuilder.pathOf("https://host/")).isEmpty();
    }

    @Test
    void emptyInputGivesNoEdges() {
        assertThat(edgeBuilder.buildEdges(List.of())).isEmpty();
        assertThat(edgeBuilder.buildEdges(engine.layoutNodes(
                List.of(ConsolidatedNode.builder().id("only").build()), GridConfig.defaults()))).isEmpty();
    }

    private List<GraphNode> traceGraph(ResolvedTraceNode... children) {
        List<ResolvedTraceNode> nodes = new ArrayList<>();
        nodes.add(ResolvedTraceNode.root(Segment.builder().id("root").name("fn").build(), "fn"));
        nodes.addAll(List.of(children));
        return engine.layoutNodes(nodes, GridConfig.defaults());
    }

    private static ResolvedTraceNode child(String id, String parentId, Segment segment) {
        return ResolvedTraceNode.builder()
                .segment(segment)
                .resolvedParentId(parentId)
                .serviceKey(id)
                .build();
    }
}
