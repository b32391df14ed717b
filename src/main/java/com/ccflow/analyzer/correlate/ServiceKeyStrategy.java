package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.Segment;

/**
 * 决定一个 trace 节点属于哪条服务泳道。
 * 可以按不同环境提供不同实现（AWS 命名空间、内部服务域名 ...）。
 */
public interface ServiceKeyStrategy {

    /**
     * 返回泳道名，不会返回 null。
     */
    String resolve(Segment segment, TraceConfig config);
}
