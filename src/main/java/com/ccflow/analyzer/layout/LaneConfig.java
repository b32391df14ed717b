package com.ccflow.analyzer.layout;

import lombok.Builder;
import lombok.Value;

/**
 * 泳道布局参数：根节点单独一列，每个服务一列，同一泳道内按 rowSpacing 往下排。
 */
@Value
@Builder(toBuilder = true)
public class LaneConfig {

    @Builder.Default
    double rootX = 400;

    @Builder.Default
    double laneBaseX = 900;

    @Builder.Default
    double laneSpacing = 350;

    @Builder.Default
    double rowSpacing = 120;

    /** 同一泳道里按深度往右缩进 */
    @Builder.Default
    double depthIndent = 50;

    @Builder.Default
    double top = 50;

    public static LaneConfig defaults() {
        return LaneConfig.builder().build();
    }
}
