package com.ccflow.analyzer.parser;

import com.ccflow.analyzer.correlate.TraceConfig;
import com.ccflow.analyzer.model.Diagnosis;
import com.ccflow.analyzer.model.HttpCall;
import com.ccflow.analyzer.model.Segment;
import com.ccflow.analyzer.model.TraceDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 X-Ray trace 导出转成一棵 Segment 树。
 *
 * 支持三种输入：
 * - {"Traces":[...]}                        : 取第一条
 * - {"Id":..., "Segments":[{"Id","Document"}]} : Document 是内嵌的 JSON 字符串
 * - 单个 segment 文档
 *
 * 各个文档按 parent_id 互相挂接，挂接会成环的拒绝（并查集判断）。
 * 顶层文档只有一个时它就是根，多个时造一个以 trace id 命名的合成根。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TraceDocumentParser {

    private final ObjectMapper objectMapper;

    public TraceDocument parse(InputStream inputStream) throws IOException {
        return parse(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
    }

    public TraceDocument parse(String content) {
        TraceDocument result = new TraceDocument();
        List<Diagnosis> diagnoses = result.getDiagnoses();
        if (content == null || content.isBlank()) {
            return result;
        }

        JsonNode tree;
        try {
            tree = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            diagnoses.add(Diagnosis.warning("TRACE_FILE", "Unreadable trace file", e.getOriginalMessage()));
            return result;
        }

        JsonNode trace = tree;
        if (tree.path("Traces").isArray()) {
            if (tree.path("Traces").isEmpty()) {
                diagnoses.add(Diagnosis.info("TRACE_FILE", "Empty trace batch", "no trace in Traces[]"));
                return result;
            }
            trace = tree.path("Traces").get(0);
        }

        List<Segment> documents = new ArrayList<>();
        if (trace.path("Segments").isArray()) {
            result.setTraceId(textOrNull(trace, "Id"));
            int index = 0;
            for (JsonNode raw : trace.path("Segments")) {
                Segment doc = readDocument(raw, index++, diagnoses);
                if (doc != null) {
                    documents.add(doc);
                }
            }
        } else if (trace.isObject() && trace.has("id")) {
            result.setTraceId(textOrNull(trace, "trace_id"));
            documents.add(toSegmentTree(trace));
        } else {
            diagnoses.add(Diagnosis.warning("TRACE_FILE", "Unknown trace format",
                    "expected Traces[], Segments[] or a segment document"));
            return result;
        }

        result.setRoot(nest(documents, result.getTraceId(), diagnoses));
        log.debug("Parsed trace: id={}, documents={}, diagnoses={}",
                result.getTraceId(), documents.size(), diagnoses.size());
        return result;
    }

    private Segment readDocument(JsonNode raw, int index, List<Diagnosis> diagnoses) {
        JsonNode document = raw.path("Document");
        try {
            JsonNode parsed = document.isTextual() ? objectMapper.readTree(document.textValue()) : document;
            if (parsed == null || !parsed.isObject()) {
                diagnoses.add(Diagnosis.warning("SEGMENT", "Skipped segment document #" + index,
                        "segment " + textOrNull(raw, "Id") + " has no document"));
                return null;
            }
            return toSegmentTree(parsed);
        } catch (JsonProcessingException e) {
            log.debug("Skip malformed segment document {}: {}", textOrNull(raw, "Id"), e.getOriginalMessage());
            diagnoses.add(Diagnosis.warning("SEGMENT", "Malformed segment document #" + index,
                    "segment " + textOrNull(raw, "Id") + ": " + e.getOriginalMessage()));
            return null;
        }
    }

    /**
     * 文档 + subsegments 转 Segment，显式工作栈，嵌套再深也不会爆栈。
     */
    Segment toSegmentTree(JsonNode document) {
        Segment root = toSegment(document);
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(document, root));

        while (!stack.isEmpty()) {
            Pending frame = stack.pop();
            for (JsonNode sub : frame.json.path("subsegments")) {
                if (!sub.isObject()) {
                    continue;
                }
                Segment child = toSegment(sub);
                frame.segment.getChildren().add(child);
                stack.push(new Pending(sub, child));
            }
        }
        return root;
    }

    private Segment toSegment(JsonNode node) {
        JsonNode aws = node.path("aws");
        JsonNode http = node.path("http");

        List<String> resourceNames = null;
        if (aws.path("resource_names").isArray()) {
            resourceNames = new ArrayList<>();
            for (JsonNode name : aws.path("resource_names")) {
                resourceNames.add(name.asText());
            }
        }

        HttpCall httpCall = null;
        if (http.isObject()) {
            JsonNode status = http.path("response").path("status");
            httpCall = HttpCall.builder()
                    .method(textOrNull(http.path("request"), "method"))
                    .url(textOrNull(http.path("request"), "url"))
                    .status(status.canConvertToInt() ? status.asInt() : null)
                    .build();
        }

        JsonNode cause = node.get("cause");

        return Segment.builder()
                .id(textOrNull(node, "id"))
                .name(textOrNull(node, "name"))
                .startTime(node.path("start_time").asDouble(0))
                .endTime(node.path("end_time").asDouble(0))
                .parentId(textOrNull(node, "parent_id"))
                .namespace(textOrNull(node, "namespace"))
                .origin(textOrNull(node, "origin"))
                .awsOperation(textOrNull(aws, "operation"))
                .awsResourceNames(resourceNames)
                .awsTableName(textOrNull(aws, "table_name"))
                .http(httpCall)
                .cause(cause == null || cause.isNull() ? null : cause.deepCopy())
                .error(node.path("error").asBoolean(false))
                .fault(node.path("fault").asBoolean(false))
                .throttle(node.path("throttle").asBoolean(false))
                .build();
    }

    /**
     * 把 parent_id 指向别的文档内节点的文档挂过去。
     */
    private Segment nest(List<Segment> documents, String traceId, List<Diagnosis> diagnoses) {
        if (documents.isEmpty()) {
            return null;
        }

        // 节点 id -> (所在文档, 节点)
        Map<String, Integer> docOf = new HashMap<>();
        Map<String, Segment> nodeById = new HashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            Deque<Segment> stack = new ArrayDeque<>();
            stack.push(documents.get(i));
            while (!stack.isEmpty()) {
                Segment s = stack.pop();
                if (s.getId() != null && !nodeById.containsKey(s.getId())) {
                    nodeById.put(s.getId(), s);
                    docOf.put(s.getId(), i);
                }
                s.getChildren().forEach(stack::push);
            }
        }

        int[] parent = new int[documents.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        // 简单 DSU 实现
        class DSU {
            int find(int x) {
                int r = x;
                while (parent[r] != r) {
                    r = parent[r];
                }
                while (parent[x] != r) {
                    int next = parent[x];
                    parent[x] = r;
                    x = next;
                }
                return r;
            }

            boolean union(int a, int b) {
                int ra = find(a);
                int rb = find(b);
                if (ra == rb) {
                    return false;
                }
                parent[rb] = ra;
                return true;
            }
        }
        DSU dsu = new DSU();

        List<Segment> topLevel = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            Segment doc = documents.get(i);
            String parentId = doc.getParentId();
            Integer target = parentId == null ? null : docOf.get(parentId);
            if (target == null) {
                topLevel.add(doc);
                continue;
            }
            if (!dsu.union(target, i)) {
                diagnoses.add(Diagnosis.warning("PARENT", "Cyclic document nesting",
                        "segment " + doc.getId() + " kept at top level"));
                topLevel.add(doc);
                continue;
            }
            nodeById.get(parentId).getChildren().add(doc);
        }

        if (topLevel.size() == 1) {
            return topLevel.get(0);
        }

        topLevel.sort(Comparator.comparingDouble(Segment::getStartTime));
        String rootId = traceId == null || traceId.isBlank() ? TraceConfig.FALLBACK_ROOT_ID : traceId;
        return Segment.builder()
                .id(rootId)
                .name(rootId)
                .startTime(topLevel.get(0).getStartTime())
                .endTime(topLevel.stream().mapToDouble(Segment::getEndTime).max().orElse(0))
                .children(new ArrayList<>(topLevel))
                .build();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static final class Pending {
        private final JsonNode json;
        private final Segment segment;

        private Pending(JsonNode json, Segment segment) {
            this.json = json;
            this.segment = segment;
        }
    }
}
