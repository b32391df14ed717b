package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.ResolvedTraceNode;
import com.ccflow.analyzer.model.Segment;
import com.ccflow.analyzer.model.TraceReconstruction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 按节点顺序列出 trace 里的 AWS 操作：Operation N: GetItem customer-table。
 * 同一个 “操作 + 资源” 只列一次。
 */
public class TraceSummarizer {

    public List<String> summarize(TraceReconstruction reconstruction) {
        if (reconstruction == null) {
            return List.of();
        }
        List<ResolvedTraceNode> ordered = new ArrayList<>();
        if (reconstruction.getRoot() != null) {
            ordered.add(reconstruction.getRoot());
        }
        ordered.addAll(reconstruction.getNodes());

        Set<String> distinct = new LinkedHashSet<>();
        for (ResolvedTraceNode node : ordered) {
            Segment segment = node.getSegment();
            if (segment == null || segment.getAwsOperation() == null) {
                continue;
            }
            distinct.add(segment.getAwsOperation() + " " + resourceOf(segment));
        }

        List<String> operations = new ArrayList<>(distinct.size());
        int index = 1;
        for (String operation : distinct) {
            operations.add("Operation " + index++ + ": " + operation);
        }
        return operations;
    }

    private static String resourceOf(Segment segment) {
        List<String> names = segment.getAwsResourceNames();
        if (names != null && !names.isEmpty() && names.get(0) != null) {
            return names.get(0);
        }
        return segment.getName();
    }
}
