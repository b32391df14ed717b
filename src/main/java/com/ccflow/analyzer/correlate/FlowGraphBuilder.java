package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.config.FlowAnalyzerProperties;
import com.ccflow.analyzer.layout.EdgeBuilder;
import com.ccflow.analyzer.layout.GraphLayoutEngine;
import com.ccflow.analyzer.layout.GridConfig;
import com.ccflow.analyzer.layout.LaneConfig;
import com.ccflow.analyzer.model.*;
import com.ccflow.analyzer.parser.ParsedLogs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 串起整条流水线：分组 / 重建 -> 布局 -> 连线，附带摘要和诊断。
 *
 * 引擎各阶段本身无状态，这里只负责按配置组装。
 */
@Component
@Slf4j
public class FlowGraphBuilder {

    private final LogGrouper logGrouper = new LogGrouper();
    private final TraceSummarizer traceSummarizer = new TraceSummarizer();
    private final GraphLayoutEngine layoutEngine = new GraphLayoutEngine();
    private final EdgeBuilder edgeBuilder = new EdgeBuilder();
    private final TraceTreeReconstructor traceReconstructor;

    private final GroupingConfig groupingConfig;
    private final TraceConfig traceConfig;
    private final GridConfig gridConfig;
    private final LaneConfig laneConfig;
    private final FlowAnalyzerProperties.TraceMode traceMode;

    public FlowGraphBuilder(FlowAnalyzerProperties properties, ServiceKeyStrategy serviceKeyStrategy) {
        this.traceReconstructor = new TraceTreeReconstructor(serviceKeyStrategy);
        this.groupingConfig = properties.toGroupingConfig();
        this.traceConfig = properties.toTraceConfig();
        this.gridConfig = properties.toGridConfig();
        this.laneConfig = properties.toLaneConfig();
        this.traceMode = properties.getLayout().getTraceMode();
    }

    /**
     * 明细视图：按分组规则合并后的日志节点，蛇形网格 + 顺序连线。
     */
    public AnalyzeResult buildLogGraph(ParsedLogs parsed) {
        List<LogEntry> logs = parsed == null ? List.of() : parsed.getLogs();
        List<ConsolidatedNode> nodes = logGrouper.groupLogs(logs, groupingConfig);
        return linearResult(logs, nodes, parsed);
    }

    /**
     * 主流程视图：同一流程的连续日志合成一个节点。
     */
    public AnalyzeResult buildFlowOverview(ParsedLogs parsed) {
        List<LogEntry> logs = parsed == null ? List.of() : parsed.getLogs();
        List<ConsolidatedNode> chunks = logGrouper.chunkByFlow(logs, groupingConfig);
        return linearResult(logs, chunks, parsed);
    }

    public AnalyzeResult buildTraceGraph(TraceDocument document) {
        List<Diagnosis> diagnoses = new ArrayList<>();
        if (document != null) {
            diagnoses.addAll(document.getDiagnoses());
        }
        Segment root = document == null ? null : document.getRoot();
        TraceReconstruction reconstruction = traceReconstructor.reconstructTraceTree(root, traceConfig);
        diagnoses.addAll(reconstruction.getDiagnoses());

        FlowGraph graph = new FlowGraph();
        if (reconstruction.getRoot() != null) {
            List<GraphNode> positioned;
            if (traceMode == FlowAnalyzerProperties.TraceMode.LANES) {
                positioned = layoutEngine.layoutLanes(reconstruction.getRoot(), reconstruction.getLanes(), laneConfig);
            } else {
                List<ResolvedTraceNode> ordered = new ArrayList<>();
                ordered.add(reconstruction.getRoot());
                ordered.addAll(reconstruction.getNodes());
                positioned = layoutEngine.layoutNodes(ordered, gridConfig);
            }
            graph.setNodes(new ArrayList<>(positioned));
            graph.setEdges(new ArrayList<>(edgeBuilder.buildCausalEdges(positioned)));
        }

        GraphSummary summary = new GraphSummary();
        List<Segment> segments = new ArrayList<>();
        if (reconstruction.getRoot() != null) {
            segments.add(reconstruction.getRoot().getSegment());
        }
        reconstruction.getNodes().forEach(n -> segments.add(n.getSegment()));
        summary.setInputCount(segments.size());
        summary.setNodeCount(graph.getNodes().size());
        summary.setEdgeCount(graph.getEdges().size());
        summary.setErrorCount((int) graph.getNodes().stream()
                .map(GraphNode::getPayload)
                .filter(p -> p != null && p.hasError())
                .count());
        summary.setStartTime(segments.stream().map(Segment::getStartTime).filter(t -> t > 0)
                .min(Comparator.naturalOrder()).map(FlowGraphBuilder::toInstant).orElse(null));
        summary.setEndTime(segments.stream().map(Segment::getEndTime).filter(t -> t > 0)
                .max(Comparator.naturalOrder()).map(FlowGraphBuilder::toInstant).orElse(null));
        summary.setOperations(traceSummarizer.summarize(reconstruction));

        log.debug("Built trace graph: nodes={}, edges={}, diagnoses={}",
                summary.getNodeCount(), summary.getEdgeCount(), diagnoses.size());
        return result(graph, summary, diagnoses);
    }

    private AnalyzeResult linearResult(List<LogEntry> logs, List<ConsolidatedNode> nodes, ParsedLogs parsed) {
        List<GraphNode> positioned = layoutEngine.layoutNodes(nodes, gridConfig);
        FlowGraph graph = new FlowGraph(new ArrayList<>(positioned),
                new ArrayList<>(edgeBuilder.buildSequentialEdges(positioned)));

        ErrorDetector errorDetector = new ErrorDetector(groupingConfig.getErrorKeywords());
        GraphSummary summary = new GraphSummary();
        summary.setInputCount(logs.size());
        summary.setNodeCount(graph.getNodes().size());
        summary.setEdgeCount(graph.getEdges().size());
        summary.setErrorCount((int) logs.stream().filter(errorDetector::isError).count());
        summary.setStartTime(logs.stream().map(LogEntry::getTimestamp).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null));
        summary.setEndTime(logs.stream().map(LogEntry::getTimestamp).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null));

        List<Diagnosis> diagnoses = new ArrayList<>();
        if (parsed != null) {
            diagnoses.addAll(parsed.getDiagnoses());
        }
        log.debug("Built log graph: input={}, nodes={}, edges={}",
                logs.size(), summary.getNodeCount(), summary.getEdgeCount());
        return result(graph, summary, diagnoses);
    }

    private static AnalyzeResult result(FlowGraph graph, GraphSummary summary, List<Diagnosis> diagnoses) {
        AnalyzeResult ar = new AnalyzeResult();
        ar.setGraph(graph);
        ar.setSummary(summary);
        ar.setDiagnoses(diagnoses);
        return ar;
    }

    // X-Ray 时间是带小数的 epoch 秒
    private static Instant toInstant(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
