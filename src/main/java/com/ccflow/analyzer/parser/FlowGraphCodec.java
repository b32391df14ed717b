package com.ccflow.analyzer.parser;

import com.ccflow.analyzer.model.FlowGraph;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * 导出 / 导入图文件：{nodes:[...], edges:[...]}，payload 带 kind（log / trace）。
 * 老的导出文件要能原样读回来，字段名不要动。
 */
@Component
@RequiredArgsConstructor
public class FlowGraphCodec {

    private final ObjectMapper objectMapper;

    public byte[] serialize(FlowGraph graph) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(graph);
    }

    public String toJson(FlowGraph graph) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
    }

    public FlowGraph deserialize(byte[] content) throws IOException {
        return objectMapper.readValue(content, FlowGraph.class);
    }

    public FlowGraph deserialize(InputStream inputStream) throws IOException {
        return objectMapper.readValue(inputStream, FlowGraph.class);
    }
}
