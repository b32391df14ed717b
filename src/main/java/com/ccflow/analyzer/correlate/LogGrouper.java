package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.ConsolidatedNode;
import com.ccflow.analyzer.model.LogEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * 把按时间升序的联络流日志合成 ConsolidatedNode 序列。
 *
 * 单次从左到右扫描，每个分组类别一个累加器，规则全部在 {@link GroupingState} 里。
 * 无状态，可并发调用。
 */
@Slf4j
public class LogGrouper {

    public List<ConsolidatedNode> groupLogs(List<LogEntry> logs, GroupingConfig config) {
        if (logs == null || logs.isEmpty()) {
            return List.of();
        }
        GroupingConfig cfg = config == null ? GroupingConfig.defaults() : config;
        NodeMerger merger = new NodeMerger(cfg, new ErrorDetector(cfg.getErrorKeywords()));

        GroupingState state = fold(index(logs), new GroupingState(cfg, merger), GroupingState::accept);
        List<ConsolidatedNode> nodes = state.finish();

        log.debug("Grouped logs: input={}, nodes={}", logs.size(), nodes.size());
        return nodes;
    }

    /**
     * 主流程视图：同一 ContactFlowName 的连续日志合成一个节点，id 为 flowName_n。
     * 子流程（MOD_ 且带 ModuleExecutionStack）的日志不进这个视图。
     */
    public List<ConsolidatedNode> chunkByFlow(List<LogEntry> logs, GroupingConfig config) {
        if (logs == null || logs.isEmpty()) {
            return List.of();
        }
        GroupingConfig cfg = config == null ? GroupingConfig.defaults() : config;
        NodeMerger merger = new NodeMerger(cfg, new ErrorDetector(cfg.getErrorKeywords()));

        Map<String, Integer> runCounts = new HashMap<>();
        List<ConsolidatedNode> chunks = new ArrayList<>();
        List<IndexedLog> run = new ArrayList<>();

        for (IndexedLog entry : index(logs)) {
            LogEntry current = entry.getLog();
            if (cfg.isSkipped(current.getModuleType()) || isModuleExecution(current, cfg)) {
                continue;
            }
            if (!run.isEmpty() && !Objects.equals(run.get(0).getLog().getFlowName(), current.getFlowName())) {
                chunks.add(closeChunk(run, runCounts, merger));
            }
            run.add(entry);
        }
        if (!run.isEmpty()) {
            chunks.add(closeChunk(run, runCounts, merger));
        }

        log.debug("Chunked logs by flow: input={}, chunks={}", logs.size(), chunks.size());
        return chunks;
    }

    /**
     * 显式折叠：state = transition(state, item)，依次处理每个元素。
     */
    public static <S, T> S fold(List<T> items, S initial, BiFunction<S, T, S> transition) {
        S state = initial;
        for (T item : items) {
            state = transition.apply(state, item);
        }
        return state;
    }

    private static List<IndexedLog> index(List<LogEntry> logs) {
        List<IndexedLog> indexed = new ArrayList<>(logs.size());
        for (int i = 0; i < logs.size(); i++) {
            LogEntry entry = logs.get(i);
            if (entry == null) {
                log.debug("Skip null log at index {}", i);
                continue;
            }
            indexed.add(new IndexedLog(i, entry));
        }
        return indexed;
    }

    private static boolean isModuleExecution(LogEntry entry, GroupingConfig cfg) {
        return cfg.mentionsModuleFlow(entry.getFlowName())
                && entry.getModuleExecutionStack() != null
                && !entry.getModuleExecutionStack().isEmpty();
    }

    private static ConsolidatedNode closeChunk(List<IndexedLog> run,
                                               Map<String, Integer> runCounts,
                                               NodeMerger merger) {
        String flowName = run.get(0).getLog().getFlowName();
        int n = runCounts.merge(String.valueOf(flowName), 1, Integer::sum);
        ConsolidatedNode chunk = merger.flowChunk(flowName + "_" + n, flowName, List.copyOf(run));
        run.clear();
        return chunk;
    }
}
