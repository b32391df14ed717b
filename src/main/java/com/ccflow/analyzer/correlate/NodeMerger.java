package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.ConsolidatedNode;
import com.ccflow.analyzer.model.LogEntry;
import com.ccflow.analyzer.model.TimeRange;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 把累加器里的成员日志合成 ConsolidatedNode。
 */
public class NodeMerger {

    public static final String MODULE_NODE_TYPE = "FlowModule";

    static final String GROUP_ERROR_RESULTS = "Error in group";

    private final GroupingConfig config;
    private final ErrorDetector errorDetector;

    public NodeMerger(GroupingConfig config, ErrorDetector errorDetector) {
        this.config = config;
        this.errorDetector = errorDetector;
    }

    /** 不参与分组的日志，原样输出，没有 footer */
    public ConsolidatedNode single(IndexedLog entry) {
        LogEntry log = entry.getLog();
        return baseOf(entry)
                .parameters(log.getParameters())
                .results(log.getResults())
                .externalResults(log.getExternalResults())
                .error(errorDetector.isError(log))
                .timeRange(new TimeRange(log.getTimestamp(), log.getTimestamp()))
                .memberCount(1)
                .sourceLogs(List.of(log))
                .build();
    }

    /**
     * 分组 flush：
     * - 1 条：原样输出，带上 footer
     * - 多条：parameters 变成数组，results / timestamp 取最后一条，任一成员出错则整组出错
     */
    public ConsolidatedNode group(List<IndexedLog> members) {
        if (members.size() == 1) {
            LogEntry only = members.get(0).getLog();
            return single(members.get(0)).toBuilder()
                    .footerResults(only.getResults())
                    .footerExternalResults(only.getExternalResults())
                    .build();
        }

        IndexedLog first = members.get(0);
        LogEntry last = members.get(members.size() - 1).getLog();
        List<LogEntry> logs = members.stream().map(IndexedLog::getLog).toList();
        boolean checkAttribute = Objects.equals(config.getCheckAttributeModuleType(), first.getLog().getModuleType());

        ArrayNode parameters = JsonNodeFactory.instance.arrayNode();
        for (LogEntry log : logs) {
            parameters.add(checkAttribute ? withResults(log) : copyOf(log.getParameters()));
        }

        boolean anyError = errorDetector.anyError(logs);
        String results = last.getResults();
        if (anyError && results == null) {
            results = GROUP_ERROR_RESULTS;
        }

        return baseOf(first)
                .timestamp(last.getTimestamp())
                .parameters(parameters)
                .results(results)
                .externalResults(last.getExternalResults())
                .footerResults(results)
                .footerExternalResults(last.getExternalResults())
                .error(anyError)
                .timeRange(rangeOf(logs))
                .memberCount(logs.size())
                .sourceLogs(logs)
                .build();
    }

    /**
     * 子流程折叠节点：label 是模块流程名，成员日志全部挂在 sourceLogs 上，下钻时再展开。
     */
    public ConsolidatedNode module(String moduleName, List<IndexedLog> members) {
        IndexedLog first = members.get(0);
        List<LogEntry> logs = members.stream().map(IndexedLog::getLog).toList();
        return baseOf(first)
                .moduleType(MODULE_NODE_TYPE)
                .label(moduleName)
                .flowName(moduleName)
                .parameters(first.getLog().getParameters())
                .results(first.getLog().getResults())
                .externalResults(first.getLog().getExternalResults())
                .error(errorDetector.anyError(logs))
                .moduleNode(true)
                .timeRange(rangeOf(logs))
                .memberCount(logs.size())
                .sourceLogs(logs)
                .build();
    }

    /**
     * 主流程视图的分块节点。
     */
    public ConsolidatedNode flowChunk(String id, String flowName, List<IndexedLog> members) {
        IndexedLog first = members.get(0);
        List<LogEntry> logs = members.stream().map(IndexedLog::getLog).toList();
        String name = flowName == null ? "Unknown Flow" : flowName;
        return baseOf(first)
                .id(id)
                .moduleType(MODULE_NODE_TYPE)
                .label(name)
                .flowName(name)
                .identifier(null)
                .error(errorDetector.anyError(logs))
                .timeRange(rangeOf(logs))
                .memberCount(logs.size())
                .sourceLogs(logs)
                .build();
    }

    public static String nodeIdOf(IndexedLog entry) {
        Instant ts = entry.getLog().getTimestamp();
        String compact = ts == null ? "unknown" : ts.toString().replace(":", "").replace(".", "");
        return compact + "_" + entry.getIndex();
    }

    static TimeRange rangeOf(List<LogEntry> logs) {
        Instant start = logs.stream().map(LogEntry::getTimestamp).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null);
        Instant end = logs.stream().map(LogEntry::getTimestamp).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);
        return new TimeRange(start, end);
    }

    private ConsolidatedNode.ConsolidatedNodeBuilder baseOf(IndexedLog entry) {
        LogEntry log = entry.getLog();
        return ConsolidatedNode.builder()
                .id(nodeIdOf(entry))
                .moduleType(log.getModuleType())
                .label(config.labelOf(log.getModuleType()))
                .flowName(log.getFlowName())
                .identifier(log.getIdentifier())
                .timestamp(log.getTimestamp());
    }

    // CheckAttribute：参数里补上自己的 Results，上游已经写进去的 _comparisonValue 等字段保持不动
    private static JsonNode withResults(LogEntry log) {
        ObjectNode item = JsonNodeFactory.instance.objectNode();
        JsonNode parameters = log.getParameters();
        if (parameters != null && parameters.isObject()) {
            item.setAll((ObjectNode) parameters.deepCopy());
        }
        if (log.getResults() == null) {
            item.putNull("Results");
        } else {
            item.put("Results", log.getResults());
        }
        return item;
    }

    private static JsonNode copyOf(JsonNode node) {
        return node == null ? NullNode.getInstance() : node.deepCopy();
    }
}
