package com.ccflow.analyzer.controller;

import com.ccflow.analyzer.correlate.FlowGraphBuilder;
import com.ccflow.analyzer.model.AnalyzeResult;
import com.ccflow.analyzer.model.FlowGraph;
import com.ccflow.analyzer.model.TraceDocument;
import com.ccflow.analyzer.parser.ContactLogParser;
import com.ccflow.analyzer.parser.FlowGraphCodec;
import com.ccflow.analyzer.parser.ParsedLogs;
import com.ccflow.analyzer.parser.TraceDocumentParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@RestController
@RequestMapping("/api/analyze")
@Slf4j
@RequiredArgsConstructor
public class AnalyzeController {

    private final ContactLogParser logParser;
    private final TraceDocumentParser traceParser;
    private final FlowGraphBuilder graphBuilder;
    private final FlowGraphCodec graphCodec;

    /**
     * 联络流日志导出文件 -> 图。view=detail（默认，分组明细）/ flow（按流程分块）。
     */
    @PostMapping(value = "/logs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalyzeResult analyzeLogs(@RequestPart("file") MultipartFile file,
                                     @RequestParam(value = "view", defaultValue = "detail") String view) throws IOException {
        log.info("收到日志文件: name={}, size={}, view={}", file.getOriginalFilename(), file.getSize(), view);
        ParsedLogs parsed = readLogs(file);
        log.info("解析得到日志条数: {}, 跳过: {}", parsed.getLogs().size(), parsed.getDiagnoses().size());
        return "flow".equalsIgnoreCase(view)
                ? graphBuilder.buildFlowOverview(parsed)
                : graphBuilder.buildLogGraph(parsed);
    }

    /**
     * X-Ray trace 导出文件 -> 图。
     */
    @PostMapping(value = "/trace", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalyzeResult analyzeTrace(@RequestPart("file") MultipartFile file) throws IOException {
        log.info("收到 trace 文件: name={}, size={}", file.getOriginalFilename(), file.getSize());
        TraceDocument document;
        try (InputStream in = file.getInputStream()) {
            document = traceParser.parse(in);
        }
        return graphBuilder.buildTraceGraph(document);
    }

    /**
     * 明细图直接导出成 {nodes, edges} 文件。
     */
    @PostMapping(value = "/logs/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> exportLogs(@RequestPart("file") MultipartFile file,
                                             @RequestParam(value = "view", defaultValue = "detail") String view) throws IOException {
        AnalyzeResult result = analyzeLogs(file, view);
        byte[] body = graphCodec.serialize(result.getGraph());
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename("callflow-graph.json").build().toString())
                .body(body);
    }

    /**
     * 读回之前导出的图文件。
     */
    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public FlowGraph importGraph(@RequestPart("file") MultipartFile file) throws IOException {
        log.info("导入图文件: name={}, size={}", file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return graphCodec.deserialize(in);
        }
    }

    private ParsedLogs readLogs(MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            return logParser.parse(in);
        }
    }
}
