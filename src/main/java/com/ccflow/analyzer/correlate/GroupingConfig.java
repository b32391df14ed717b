package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.GroupingKind;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LogGrouper 的配置。全部不可变，一次分组运行内不会变化。
 *
 * kindByModuleType 里没有的 moduleType 一律按 UNGROUPED 处理。
 */
@Value
@Builder(toBuilder = true)
public class GroupingConfig {

    public static final List<String> DEFAULT_ERROR_KEYWORDS = List.of(
            "Error", "Failed", "Timeout", "Exception", "Invalid", "not found", "NotDone", "MultipleFound"
    );

    @Builder.Default
    Set<String> skipModuleTypes = Set.of("null");

    @Builder.Default
    Map<String, GroupingKind> kindByModuleType = defaultKinds();

    @Builder.Default
    List<String> errorKeywords = DEFAULT_ERROR_KEYWORDS;

    @Builder.Default
    String invokeModuleType = "InvokeFlowModule";

    @Builder.Default
    String returnModuleType = "ReturnFromFlowModule";

    /** ContactFlowName 里带这个标记的是子流程（模块）日志 */
    @Builder.Default
    String moduleFlowMarker = "MOD_";

    /** 合并时每个参数项要带上自己 Results 的类型 */
    @Builder.Default
    String checkAttributeModuleType = "CheckAttribute";

    /** moduleType -> 展示名，没配的直接用 moduleType */
    @Builder.Default
    Map<String, String> labels = Map.of();

    public static GroupingConfig defaults() {
        return GroupingConfig.builder().build();
    }

    public GroupingKind kindOf(String moduleType) {
        if (moduleType == null) {
            return GroupingKind.UNGROUPED;
        }
        return kindByModuleType.getOrDefault(moduleType, GroupingKind.UNGROUPED);
    }

    public String labelOf(String moduleType) {
        if (moduleType == null) {
            return "Unknown";
        }
        return labels.getOrDefault(moduleType, moduleType);
    }

    public boolean isSkipped(String moduleType) {
        return skipModuleTypes.contains(String.valueOf(moduleType));
    }

    /** 明细视图：流程名以标记开头才算子流程 */
    public boolean isModuleFlow(String flowName) {
        return hasMarker() && flowName != null && flowName.startsWith(moduleFlowMarker);
    }

    /** 主流程视图的过滤条件：流程名里出现标记即可 */
    public boolean mentionsModuleFlow(String flowName) {
        return hasMarker() && flowName != null && flowName.contains(moduleFlowMarker);
    }

    private boolean hasMarker() {
        return moduleFlowMarker != null && !moduleFlowMarker.isEmpty();
    }

    /**
     * 把 “类别 -> moduleType 列表” 倒排成 “moduleType -> 类别”。同一个 moduleType 配在多个类别下时，后配置的生效。
     */
    public static Map<String, GroupingKind> indexCategories(Map<GroupingKind, ? extends Collection<String>> categories) {
        Map<String, GroupingKind> index = new LinkedHashMap<>();
        if (categories == null) {
            return index;
        }
        categories.forEach((kind, moduleTypes) -> {
            if (moduleTypes == null) {
                return;
            }
            for (String moduleType : moduleTypes) {
                if (moduleType != null && !moduleType.isBlank()) {
                    index.put(moduleType.trim(), kind);
                }
            }
        });
        return index;
    }

    private static Map<String, GroupingKind> defaultKinds() {
        Map<GroupingKind, List<String>> categories = new LinkedHashMap<>();
        categories.put(GroupingKind.ATTRIBUTE_SET, List.of("SetAttributes", "SetFlowAttributes", "CheckAttribute"));
        categories.put(GroupingKind.USER_INPUT, List.of("GetUserInput", "StoreUserInput"));
        categories.put(GroupingKind.EXTERNAL_INVOKE, List.of("InvokeExternalResource", "InvokeLambdaFunction"));
        categories.put(GroupingKind.DIAL, List.of("Dial"));
        return Map.copyOf(indexCategories(categories));
    }
}
