package com.ccflow.analyzer.parser;

import com.ccflow.analyzer.model.LogEntry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ContactLogParserTest {

    private final ContactLogParser parser = new ContactLogParser(JsonSupport.newMapper());

    @Test
    void readsJsonArrayAndSortsByTimestamp() throws IOException {
        ParsedLogs parsed;
        try (InputStream in = fixture("contact-logs.json")) {
            parsed = parser.parse(in);
        }

        assertThat(parsed.getLogs()).hasSize(10);
        assertThat(parsed.getDiagnoses()).isEmpty();
        LogEntry first = parsed.getLogs().get(0);
        assertThat(first.getIdentifier()).isEqualTo("a1");
        assertThat(first.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(first.getFlowName()).isEqualTo("Main");
        assertThat(first.getModuleType()).isEqualTo("SetAttributes");
        assertThat(first.getParameters().path("Value").asText()).isEqualTo("gold");
        assertThat(parsed.getLogs().get(5).getModuleExecutionStack()).containsExactly("mod-1");
    }

    @Test
    void readsOneRecordPerLineAndSkipsBrokenLines() throws IOException {
        ParsedLogs parsed;
        try (InputStream in = fixture("contact-logs.ndjson")) {
            parsed = parser.parse(in);
        }

        assertThat(parsed.getLogs()).extracting(LogEntry::getIdentifier).containsExactly("x0", "x1");
        assertThat(parsed.getDiagnoses()).hasSize(1);
        assertThat(parsed.getDiagnoses().get(0).getTitle()).isEqualTo("Skipped log line 2");
    }

    @Test
    void entriesWithoutTimestampGoLast() {
        String content = "{\"ContactFlowModuleType\":\"PlayPrompt\",\"Identifier\":\"late\"}\n"
                + "{\"Timestamp\":\"2024-03-01T10:00:00Z\",\"ContactFlowModuleType\":\"PlayPrompt\",\"Identifier\":\"early\"}";

        ParsedLogs parsed = parser.parse(content);

        assertThat(parsed.getLogs()).extracting(LogEntry::getIdentifier).containsExactly("early", "late");
    }

    @Test
    void brokenArrayIsReportedNotThrown() {
        ParsedLogs parsed = parser.parse("[{\"Identifier\": ");

        assertThat(parsed.getLogs()).isEmpty();
        assertThat(parsed.getDiagnoses()).extracting("type").containsExactly("LOG_FILE");
    }

    @Test
    void blankInputGivesNothing() {
        assertThat(parser.parse("  ").getLogs()).isEmpty();
    }

    static InputStream fixture(String name) {
        return ContactLogParserTest.class.getResourceAsStream("/fixtures/" + name);
    }
}
