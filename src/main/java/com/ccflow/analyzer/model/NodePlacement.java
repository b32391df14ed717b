package com.ccflow.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 布局结果：坐标 + 出入挂点。sourcePort 为 null 表示没有下一个节点。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodePlacement {
    private Position position;
    private Port sourcePort;
    private Port targetPort;
}
