package com.ccflow.analyzer.config;

import com.ccflow.analyzer.correlate.GroupingConfig;
import com.ccflow.analyzer.correlate.TraceConfig;
import com.ccflow.analyzer.layout.GridConfig;
import com.ccflow.analyzer.model.GroupingKind;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowAnalyzerPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfig.class);

    @Test
    void defaultsMatchBuiltInEngineConfig() {
        contextRunner.run(context -> {
            FlowAnalyzerProperties properties = context.getBean(FlowAnalyzerProperties.class);

            GroupingConfig grouping = properties.toGroupingConfig();
            assertThat(grouping.kindOf("SetAttributes")).isEqualTo(GroupingKind.ATTRIBUTE_SET);
            assertThat(grouping.kindOf("Dial")).isEqualTo(GroupingKind.DIAL);
            assertThat(grouping.isSkipped(null)).isTrue();
            assertThat(grouping.getErrorKeywords()).hasSize(8);

            TraceConfig trace = properties.toTraceConfig();
            assertThat(trace.isSkipped("Attempt #2")).isTrue();
            assertThat(trace.isSkipped("DynamoDB")).isFalse();

            GridConfig grid = properties.toGridConfig();
            assertThat(grid.getColumns()).isEqualTo(5);
            assertThat(grid.getNodeWidth()).isEqualTo(280.0);
            assertThat(properties.getLayout().getTraceMode()).isEqualTo(FlowAnalyzerProperties.TraceMode.GRID);
        });
    }

    @Test
    void bindsCategoriesLabelsAndLayout() {
        contextRunner
                .withPropertyValues(
                        "callflow.grouping.categories.dial=Dial,TransferToQueue",
                        "callflow.grouping.categories.user-input=GetUserInput",
                        "callflow.labels.[PlayPrompt]=Play prompt",
                        "callflow.trace.skip-names=Overhead,Retry*",
                        "callflow.trace.service-hosts.[api.example.com]=Example API",
                        "callflow.layout.columns=3",
                        "callflow.layout.trace-mode=lanes")
                .run(context -> {
                    FlowAnalyzerProperties properties = context.getBean(FlowAnalyzerProperties.class);

                    GroupingConfig grouping = properties.toGroupingConfig();
                    assertThat(grouping.kindOf("TransferToQueue")).isEqualTo(GroupingKind.DIAL);
                    assertThat(grouping.kindOf("GetUserInput")).isEqualTo(GroupingKind.USER_INPUT);
                    assertThat(grouping.kindOf("SetAttributes")).isEqualTo(GroupingKind.UNGROUPED);
                    assertThat(grouping.labelOf("PlayPrompt")).isEqualTo("Play prompt");

                    TraceConfig trace = properties.toTraceConfig();
                    assertThat(trace.isSkipped("Retry 1")).isTrue();
                    assertThat(trace.isSkipped("Invocation")).isFalse();
                    assertThat(trace.getServiceHosts()).containsEntry("api.example.com", "Example API");

                    assertThat(properties.toGridConfig().getColumns()).isEqualTo(3);
                    assertThat(properties.getLayout().getTraceMode()).isEqualTo(FlowAnalyzerProperties.TraceMode.LANES);
                });
    }

    @Test
    void invalidColumnsFailWhenConverted() {
        FlowAnalyzerProperties properties = new FlowAnalyzerProperties();
        properties.getLayout().setColumns(0);

        assertThatThrownBy(properties::toGridConfig).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownCategoryKeyIsRejected() {
        FlowAnalyzerProperties properties = new FlowAnalyzerProperties();
        properties.getGrouping().getCategories().put("no-such-kind", List.of("X"));

        assertThatThrownBy(properties::toGroupingConfig).isInstanceOf(IllegalArgumentException.class);
    }

    @Configuration
    @EnableConfigurationProperties(FlowAnalyzerProperties.class)
    static class TestConfig {
    }
}
