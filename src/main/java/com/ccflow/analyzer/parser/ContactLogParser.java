package com.ccflow.analyzer.parser;

import com.ccflow.analyzer.model.Diagnosis;
import com.ccflow.analyzer.model.LogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 读 CloudWatch 导出的联络流日志：整体一个 JSON 数组，或者一行一个 JSON 对象。
 * 解析失败的行跳过并记诊断；结果按 Timestamp 稳定升序，没有时间的排最后。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContactLogParser {

    private static final int SAMPLE_LENGTH = 120;

    private final ObjectMapper objectMapper;

    public ParsedLogs parse(InputStream inputStream) throws IOException {
        String content;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            content = br.lines().collect(Collectors.joining("\n"));
        }
        return parse(content);
    }

    public ParsedLogs parse(String content) {
        ParsedLogs result = new ParsedLogs();
        if (content == null || content.isBlank()) {
            return result;
        }

        String trimmed = content.strip();
        if (trimmed.startsWith("[")) {
            parseArray(trimmed, result);
        } else {
            parseLines(content, result);
        }

        result.getLogs().sort(Comparator.comparing(LogEntry::getTimestamp,
                Comparator.nullsLast(Comparator.naturalOrder())));

        log.debug("Parsed contact logs: entries={}, skipped={}",
                result.getLogs().size(), result.getDiagnoses().size());
        return result;
    }

    private void parseArray(String content, ParsedLogs result) {
        JsonNode array;
        try {
            array = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            result.getDiagnoses().add(Diagnosis.warning("LOG_FILE", "Unreadable log array", e.getOriginalMessage()));
            return;
        }

        int index = 0;
        for (JsonNode element : array) {
            try {
                result.getLogs().add(objectMapper.treeToValue(element, LogEntry.class));
            } catch (JsonProcessingException e) {
                result.getDiagnoses().add(Diagnosis.warning("LOG_LINE", "Skipped log record #" + index,
                        e.getOriginalMessage()));
            }
            index++;
        }
    }

    private void parseLines(String content, ParsedLogs result) {
        List<String> lines = content.lines().toList();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            try {
                result.getLogs().add(objectMapper.readValue(line, LogEntry.class));
            } catch (JsonProcessingException e) {
                log.debug("Skip unparseable log line {}: {}", i + 1, e.getOriginalMessage());
                Diagnosis diagnosis = Diagnosis.warning("LOG_LINE", "Skipped log line " + (i + 1), sample(line));
                diagnosis.setHints(List.of(String.valueOf(e.getOriginalMessage())));
                result.getDiagnoses().add(diagnosis);
            }
        }
    }

    private static String sample(String line) {
        return line.length() <= SAMPLE_LENGTH ? line : line.substring(0, SAMPLE_LENGTH) + "...";
    }
}
