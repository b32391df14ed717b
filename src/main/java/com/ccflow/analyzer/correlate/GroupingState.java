package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.ConsolidatedNode;
import com.ccflow.analyzer.model.GroupingKind;
import com.ccflow.analyzer.model.LogEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 分组折叠的累加状态。每次 groupLogs 调用新建一个，不跨调用共享。
 *
 * 状态：
 * - open：每个分组类别最多一个打开的累加器
 * - pendingInvoke：刚遇到的子流程调用，等下一条决定是折叠还是单独输出
 * - moduleName / moduleRun：正在收集的子流程日志
 */
@Slf4j
public class GroupingState {

    private final GroupingConfig config;
    private final NodeMerger merger;

    private final List<ConsolidatedNode> emitted = new ArrayList<>();
    private final Map<GroupingKind, List<IndexedLog>> open = new EnumMap<>(GroupingKind.class);

    private IndexedLog pendingInvoke;
    private String moduleName;
    private final List<IndexedLog> moduleRun = new ArrayList<>();

    public GroupingState(GroupingConfig config, NodeMerger merger) {
        this.config = config;
        this.merger = merger;
    }

    /**
     * 吃进一条日志，返回自身（fold 的 transition）。
     */
    public GroupingState accept(IndexedLog entry) {
        LogEntry current = entry.getLog();

        if (config.isSkipped(current.getModuleType())) {
            log.debug("Skip log: index={}, moduleType={}", entry.getIndex(), current.getModuleType());
            return this;
        }

        // 1. 子流程收集中：同名流程继续收，否则收尾；紧跟的 Return 一并吃掉
        if (moduleName != null) {
            if (moduleName.equals(current.getFlowName())) {
                moduleRun.add(entry);
                return this;
            }
            closeModuleRun();
            if (isReturn(current)) {
                return this;
            }
        }

        // 2. 上一条是调用：后面跟着模块日志才折叠
        if (pendingInvoke != null) {
            IndexedLog invoke = pendingInvoke;
            pendingInvoke = null;
            if (config.isModuleFlow(current.getFlowName())) {
                moduleName = current.getFlowName();
                moduleRun.add(entry);
                return this;
            }
            emitted.add(merger.single(invoke));
        }

        if (isInvoke(current)) {
            flushAll();
            pendingInvoke = entry;
            return this;
        }

        // 没有调用在前的模块日志 / Return，直接丢弃
        if (config.isModuleFlow(current.getFlowName()) || isReturn(current)) {
            log.debug("Drop stray sub-flow log: index={}, flow={}, moduleType={}",
                    entry.getIndex(), current.getFlowName(), current.getModuleType());
            return this;
        }

        GroupingKind kind = kindOf(current);
        flushExcept(kind);

        if (kind == GroupingKind.UNGROUPED) {
            emitted.add(merger.single(entry));
            return this;
        }

        List<IndexedLog> members = open.get(kind);
        if (members != null && !sameGroup(kind, members.get(0).getLog(), current)) {
            flush(kind);
        }
        open.computeIfAbsent(kind, k -> new ArrayList<>()).add(entry);
        return this;
    }

    /**
     * 输入结束：收尾子流程、输出挂起的调用、flush 全部累加器。
     */
    public List<ConsolidatedNode> finish() {
        if (moduleName != null) {
            closeModuleRun();
        }
        if (pendingInvoke != null) {
            emitted.add(merger.single(pendingInvoke));
            pendingInvoke = null;
        }
        flushAll();
        return List.copyOf(emitted);
    }

    /** 缺 Identifier 或 ContactFlowName 的日志不参与分组 */
    GroupingKind kindOf(LogEntry current) {
        if (current.getIdentifier() == null || current.getFlowName() == null) {
            return GroupingKind.UNGROUPED;
        }
        return config.kindOf(current.getModuleType());
    }

    private boolean sameGroup(GroupingKind kind, LogEntry head, LogEntry next) {
        if (kind.identifierScoped()) {
            return Objects.equals(head.getIdentifier(), next.getIdentifier());
        }
        return Objects.equals(head.getModuleType(), next.getModuleType());
    }

    private boolean isInvoke(LogEntry current) {
        return Objects.equals(config.getInvokeModuleType(), current.getModuleType());
    }

    private boolean isReturn(LogEntry current) {
        return Objects.equals(config.getReturnModuleType(), current.getModuleType());
    }

    private void closeModuleRun() {
        emitted.add(merger.module(moduleName, List.copyOf(moduleRun)));
        moduleName = null;
        moduleRun.clear();
    }

    private void flushExcept(GroupingKind kind) {
        for (GroupingKind openKind : List.copyOf(open.keySet())) {
            if (openKind != kind) {
                flush(openKind);
            }
        }
    }

    private void flushAll() {
        flushExcept(null);
    }

    private void flush(GroupingKind kind) {
        List<IndexedLog> members = open.remove(kind);
        if (members != null && !members.isEmpty()) {
            emitted.add(merger.group(members));
        }
    }
}
