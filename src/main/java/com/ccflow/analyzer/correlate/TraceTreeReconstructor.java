package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.Diagnosis;
import com.ccflow.analyzer.model.ResolvedTraceNode;
import com.ccflow.analyzer.model.Segment;
import com.ccflow.analyzer.model.TraceReconstruction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把嵌套的 trace 段树摊平成 ResolvedTraceNode 列表，跳过 Invocation / Attempt 这类包装段，
 * 并把它们的子段挂到最近的真实祖先上。
 *
 * 全程显式工作栈，不递归：
 * 1. 遍历段树，建 id 索引 + 结构父节点（嵌套关系）
 * 2. 对每个非包装段向上找父节点，穿过包装段；缺失或成环时退回根
 * 3. 全局再查一次父链环，算深度
 *
 * 数据有问题只记诊断，不抛异常。
 */
@Slf4j
public class TraceTreeReconstructor {

    private final ServiceKeyStrategy serviceKeyStrategy;

    public TraceTreeReconstructor() {
        this(new DefaultServiceKeyStrategy());
    }

    public TraceTreeReconstructor(ServiceKeyStrategy serviceKeyStrategy) {
        this.serviceKeyStrategy = serviceKeyStrategy;
    }

    public TraceReconstruction reconstructTraceTree(Segment root, TraceConfig config) {
        TraceReconstruction result = new TraceReconstruction();
        if (root == null) {
            return result;
        }
        TraceConfig cfg = config == null ? TraceConfig.defaults() : config;
        List<Diagnosis> diagnoses = result.getDiagnoses();

        String rootId = root.getId();
        if (rootId == null || rootId.isBlank()) {
            rootId = TraceConfig.FALLBACK_ROOT_ID;
            diagnoses.add(Diagnosis.warning("SEGMENT", "Trace root without id",
                    "root segment '" + root.getName() + "' has no id, using " + rootId));
        }

        // ===== 1. 遍历段树 =====
        Map<String, Segment> byId = new HashMap<>();
        Map<String, String> enclosingOf = new HashMap<>();
        List<Segment> emitted = new ArrayList<>();
        Set<Segment> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        Deque<Frame> stack = new ArrayDeque<>();
        seen.add(root);
        pushChildren(stack, root, rootId);

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Segment segment = frame.segment;
            if (segment == null || !seen.add(segment)) {
                continue;
            }

            String id = segment.getId();
            if (id == null || id.isBlank()) {
                diagnoses.add(Diagnosis.warning("SEGMENT", "Segment without id",
                        "segment '" + segment.getName() + "' skipped, children kept"));
                pushChildren(stack, segment, frame.enclosingId);
                continue;
            }
            if (id.equals(rootId) || byId.containsKey(id)) {
                diagnoses.add(Diagnosis.warning("SEGMENT", "Duplicate segment id",
                        "segment " + id + " (" + segment.getName() + ") skipped, children kept"));
                pushChildren(stack, segment, frame.enclosingId);
                continue;
            }

            byId.put(id, segment);
            enclosingOf.put(id, frame.enclosingId);
            if (cfg.isSkipped(segment.getName())) {
                log.debug("Skip wrapper segment: id={}, name={}", id, segment.getName());
            } else {
                emitted.add(segment);
            }
            pushChildren(stack, segment, id);
        }

        // ===== 2. 逐个解析父节点 =====
        Map<String, String> parentOf = new LinkedHashMap<>();
        for (Segment segment : emitted) {
            parentOf.put(segment.getId(), resolveParent(segment, rootId, byId, enclosingOf, cfg, diagnoses));
        }

        // ===== 3. 父链环 + 深度 =====
        Map<String, Integer> depthOf = computeDepths(parentOf, rootId, diagnoses);

        Segment rootCopy = root.toBuilder().id(rootId).build();
        result.setRoot(ResolvedTraceNode.root(rootCopy, serviceKeyStrategy.resolve(rootCopy, cfg)));

        for (Segment segment : emitted) {
            String id = segment.getId();
            ResolvedTraceNode node = ResolvedTraceNode.builder()
                    .segment(segment.withoutChildren())
                    .resolvedParentId(parentOf.get(id))
                    .depth(depthOf.get(id))
                    .serviceKey(serviceKeyStrategy.resolve(segment, cfg))
                    .build();
            result.getNodes().add(node);
            result.getLanes().computeIfAbsent(node.getServiceKey(), k -> new ArrayList<>()).add(node);
        }

        log.debug("Reconstructed trace: root={}, nodes={}, lanes={}, diagnoses={}",
                rootId, result.getNodes().size(), result.getLanes().size(), diagnoses.size());
        return result;
    }

    /**
     * 从字面 parentId（没有就用嵌套关系）向上走，遇到包装段继续往上。
     * visited 里先放自己，防止自指。
     */
    private String resolveParent(Segment segment,
                                 String rootId,
                                 Map<String, Segment> byId,
                                 Map<String, String> enclosingOf,
                                 TraceConfig cfg,
                                 List<Diagnosis> diagnoses) {
        Set<String> visited = new HashSet<>();
        visited.add(segment.getId());
        String candidate = parentCandidate(segment, enclosingOf);

        while (true) {
            if (candidate == null || candidate.equals(rootId)) {
                return rootId;
            }
            if (!visited.add(candidate)) {
                log.debug("Parent cycle: segment={}, at={}", segment.getId(), candidate);
                diagnoses.add(Diagnosis.warning("PARENT", "Cyclic parent reference",
                        "segment " + segment.getId() + " re-rooted at " + rootId));
                return rootId;
            }
            Segment parent = byId.get(candidate);
            if (parent == null) {
                log.debug("Missing parent: segment={}, parentId={}", segment.getId(), candidate);
                diagnoses.add(Diagnosis.warning("PARENT", "Unknown parent segment",
                        "segment " + segment.getId() + " points to missing " + candidate + ", re-rooted at " + rootId));
                return rootId;
            }
            if (!cfg.isSkipped(parent.getName())) {
                return candidate;
            }
            candidate = parentCandidate(parent, enclosingOf);
        }
    }

    private static String parentCandidate(Segment segment, Map<String, String> enclosingOf) {
        String literal = segment.getParentId();
        if (literal != null && !literal.isBlank()) {
            return literal;
        }
        return enclosingOf.get(segment.getId());
    }

    /**
     * 真实段之间也可能通过 parentId 互相指向。沿父链走，碰到当前路径上的节点就把它改挂到根，然后重走。
     */
    private Map<String, Integer> computeDepths(Map<String, String> parentOf,
                                               String rootId,
                                               List<Diagnosis> diagnoses) {
        Map<String, Integer> depthOf = new HashMap<>();

        for (String start : parentOf.keySet()) {
            Deque<String> path = new ArrayDeque<>();
            Set<String> onPath = new HashSet<>();
            String current = start;

            while (current != null && !depthOf.containsKey(current)) {
                if (!onPath.add(current)) {
                    log.debug("Break parent cycle at {}", current);
                    diagnoses.add(Diagnosis.warning("PARENT", "Cyclic parent chain",
                            "segment " + current + " re-rooted at " + rootId));
                    parentOf.put(current, rootId);
                    path.clear();
                    onPath.clear();
                    current = start;
                    continue;
                }
                path.push(current);
                String parent = parentOf.get(current);
                current = rootId.equals(parent) ? null : parent;
            }

            while (!path.isEmpty()) {
                String id = path.pop();
                String parent = parentOf.get(id);
                depthOf.put(id, rootId.equals(parent) ? 0 : depthOf.get(parent) + 1);
            }
        }
        return depthOf;
    }

    // 逆序入栈，出栈时保持文档顺序
    private static void pushChildren(Deque<Frame> stack, Segment segment, String enclosingId) {
        List<Segment> children = segment.getChildren();
        if (children == null) {
            return;
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), enclosingId));
        }
    }

    private static final class Frame {
        private final Segment segment;
        private final String enclosingId;

        private Frame(Segment segment, String enclosingId) {
            this.segment = segment;
            this.enclosingId = enclosingId;
        }
    }
}
