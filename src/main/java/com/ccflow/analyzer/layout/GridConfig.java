package com.ccflow.analyzer.layout;

import lombok.Builder;
import lombok.Value;

/**
 * 网格布局参数。columns 必须 >= 1，构造时就检查。
 */
@Value
public class GridConfig {

    int columns;
    double nodeWidth;
    double nodeHeight;
    double horizontalGap;
    double verticalGap;

    @Builder(toBuilder = true)
    public GridConfig(Integer columns, Double nodeWidth, Double nodeHeight, Double horizontalGap, Double verticalGap) {
        this.columns = columns == null ? 5 : columns;
        this.nodeWidth = nodeWidth == null ? 280 : nodeWidth;
        this.nodeHeight = nodeHeight == null ? 180 : nodeHeight;
        this.horizontalGap = horizontalGap == null ? 40 : horizontalGap;
        this.verticalGap = verticalGap == null ? 80 : verticalGap;
        if (this.columns < 1) {
            throw new IllegalArgumentException("columns must be >= 1, got " + this.columns);
        }
    }

    public static GridConfig defaults() {
        return GridConfig.builder().build();
    }

    public static GridConfig ofColumns(int columns) {
        return GridConfig.builder().columns(columns).build();
    }
}
