package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.LogEntry;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorDetectorTest {

    private final ErrorDetector detector = new ErrorDetector(GroupingConfig.DEFAULT_ERROR_KEYWORDS);

    @Test
    void keywordMatchIsCaseSensitiveSubstring() {
        assertThat(detector.isError(results("Timeout"))).isTrue();
        assertThat(detector.isError(results("Contact not found"))).isTrue();
        assertThat(detector.isError(results("MultipleFound"))).isTrue();
        assertThat(detector.isError(results("timeout"))).isFalse();
        assertThat(detector.isError(results("Success"))).isFalse();
    }

    @Test
    void businessTextContainingKeywordStillCounts() {
        assertThat(detector.isError(results("no Error found"))).isTrue();
    }

    @Test
    void externalResultsFailureIsStringFalseOnly() {
        ObjectNode failed = JsonNodeFactory.instance.objectNode().put("isSuccess", "false");
        ObjectNode booleanFalse = JsonNodeFactory.instance.objectNode().put("isSuccess", false);

        assertThat(detector.isError(LogEntry.builder().externalResults(failed).build())).isTrue();
        assertThat(detector.isError(LogEntry.builder().externalResults(booleanFalse).build())).isFalse();
        assertThat(detector.isError(null)).isFalse();
    }

    private static LogEntry results(String results) {
        return LogEntry.builder().results(results).build();
    }
}
