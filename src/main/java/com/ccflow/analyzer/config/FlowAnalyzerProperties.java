package com.ccflow.analyzer.config;

import com.ccflow.analyzer.correlate.GroupingConfig;
import com.ccflow.analyzer.correlate.TraceConfig;
import com.ccflow.analyzer.layout.GridConfig;
import com.ccflow.analyzer.layout.LaneConfig;
import com.ccflow.analyzer.model.GroupingKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * callflow.* 配置，转成各个引擎阶段用的不可变配置。
 *
 * 注意 yml 里 moduleType / host 作为 map key 时要用 "[SetAttributes]" 这种写法，否则大小写和点会被改掉。
 */
@Data
@ConfigurationProperties(prefix = "callflow")
public class FlowAnalyzerProperties {

    private Grouping grouping = new Grouping();

    /** moduleType -> 展示名 */
    private Map<String, String> labels = new LinkedHashMap<>();

    private Trace trace = new Trace();

    private Layout layout = new Layout();

    @Data
    public static class Grouping {
        private List<String> skipModuleTypes = new ArrayList<>(List.of("null"));

        /** attribute-set / user-input / external-invoke / dial -> moduleType 列表；为空时用内置分类 */
        private Map<String, List<String>> categories = new LinkedHashMap<>();

        private List<String> errorKeywords = new ArrayList<>(GroupingConfig.DEFAULT_ERROR_KEYWORDS);

        private SubFlow subFlow = new SubFlow();
    }

    @Data
    public static class SubFlow {
        private String invokeModuleType = "InvokeFlowModule";
        private String returnModuleType = "ReturnFromFlowModule";
        private String moduleFlowMarker = "MOD_";
        private String checkAttributeModuleType = "CheckAttribute";
    }

    @Data
    public static class Trace {
        private List<String> skipNames = new ArrayList<>(TraceConfig.DEFAULT_SKIP_NAMES);

        /** URL host 片段 -> 泳道名 */
        private Map<String, String> serviceHosts = new LinkedHashMap<>();
    }

    @Data
    public static class Layout {
        private int columns = 5;
        private double nodeWidth = 280;
        private double nodeHeight = 180;
        private double horizontalGap = 40;
        private double verticalGap = 80;
        private TraceMode traceMode = TraceMode.GRID;
        private Lane lane = new Lane();
    }

    @Data
    public static class Lane {
        private double rootX = 400;
        private double baseX = 900;
        private double spacing = 350;
        private double rowSpacing = 120;
        private double depthIndent = 50;
        private double top = 50;
    }

    public enum TraceMode {
        GRID,
        LANES
    }

    public GroupingConfig toGroupingConfig() {
        GroupingConfig.GroupingConfigBuilder builder = GroupingConfig.builder()
                .skipModuleTypes(new LinkedHashSet<>(grouping.getSkipModuleTypes()))
                .errorKeywords(List.copyOf(grouping.getErrorKeywords()))
                .invokeModuleType(grouping.getSubFlow().getInvokeModuleType())
                .returnModuleType(grouping.getSubFlow().getReturnModuleType())
                .moduleFlowMarker(grouping.getSubFlow().getModuleFlowMarker())
                .checkAttributeModuleType(grouping.getSubFlow().getCheckAttributeModuleType())
                .labels(Map.copyOf(labels));

        if (!grouping.getCategories().isEmpty()) {
            Map<GroupingKind, List<String>> byKind = new LinkedHashMap<>();
            grouping.getCategories().forEach((key, moduleTypes) -> byKind.put(GroupingKind.fromKey(key), moduleTypes));
            builder.kindByModuleType(Map.copyOf(GroupingConfig.indexCategories(byKind)));
        }
        return builder.build();
    }

    public TraceConfig toTraceConfig() {
        return TraceConfig.builder()
                .skipNames(List.copyOf(trace.getSkipNames()))
                .serviceHosts(new LinkedHashMap<>(trace.getServiceHosts()))
                .build();
    }

    public GridConfig toGridConfig() {
        return GridConfig.builder()
                .columns(layout.getColumns())
                .nodeWidth(layout.getNodeWidth())
                .nodeHeight(layout.getNodeHeight())
                .horizontalGap(layout.getHorizontalGap())
                .verticalGap(layout.getVerticalGap())
                .build();
    }

    public LaneConfig toLaneConfig() {
        Lane lane = layout.getLane();
        return LaneConfig.builder()
                .rootX(lane.getRootX())
                .laneBaseX(lane.getBaseX())
                .laneSpacing(lane.getSpacing())
                .rowSpacing(lane.getRowSpacing())
                .depthIndent(lane.getDepthIndent())
                .top(lane.getTop())
                .build();
    }
}
