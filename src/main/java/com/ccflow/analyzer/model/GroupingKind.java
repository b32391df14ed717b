package com.ccflow.analyzer.model;

import java.util.Locale;

/**
 * 日志分组类别。配置里用 attribute-set / user-input ... 这种写法。
 */
public enum GroupingKind {
    ATTRIBUTE_SET,
    USER_INPUT,
    EXTERNAL_INVOKE,
    DIAL,
    UNGROUPED;

    /** 这几类按 Identifier 分组，ATTRIBUTE_SET 按 moduleType 分组 */
    public boolean identifierScoped() {
        return this == USER_INPUT || this == EXTERNAL_INVOKE || this == DIAL;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static GroupingKind fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("grouping kind must not be blank");
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return GroupingKind.valueOf(normalized);
    }
}
