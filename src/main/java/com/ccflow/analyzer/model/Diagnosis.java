package com.ccflow.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Diagnosis {
    private String type;        // 例如 LOG_LINE, SEGMENT, PARENT
    private String severity;    // INFO / WARNING / ERROR
    private String title;       // 人类可读标题
    private String detail;      // 详情
    private List<String> hints; // 建议

    public static Diagnosis warning(String type, String title, String detail) {
        return new Diagnosis(type, "WARNING", title, detail, List.of());
    }

    public static Diagnosis info(String type, String title, String detail) {
        return new Diagnosis(type, "INFO", title, detail, List.of());
    }
}
