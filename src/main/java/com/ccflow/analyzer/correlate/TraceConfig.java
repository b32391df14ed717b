package com.ccflow.analyzer.correlate;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * TraceTreeReconstructor 的配置。
 *
 * skipNames：合成包装段的名字，结尾带 * 的按前缀匹配（Attempt* 匹配 Attempt #1 ...）。
 * serviceHosts：URL host 片段 -> 泳道名，给 HTTP 调用分类用。
 */
@Value
@Builder(toBuilder = true)
public class TraceConfig {

    public static final List<String> DEFAULT_SKIP_NAMES = List.of(
            "Overhead", "Dwell Time", "Lambda", "Invocation", "Attempt*", "QueueTime", "Initialization"
    );

    /** 根段 id 缺失时用这个 */
    public static final String FALLBACK_ROOT_ID = "trace-root";

    @Builder.Default
    List<String> skipNames = DEFAULT_SKIP_NAMES;

    @Builder.Default
    Map<String, String> serviceHosts = Map.of();

    public static TraceConfig defaults() {
        return TraceConfig.builder().build();
    }

    public boolean isSkipped(String segmentName) {
        if (segmentName == null) {
            return false;
        }
        for (String pattern : skipNames) {
            if (pattern.endsWith("*")) {
                if (segmentName.startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (pattern.equals(segmentName)) {
                return true;
            }
        }
        return false;
    }
}
