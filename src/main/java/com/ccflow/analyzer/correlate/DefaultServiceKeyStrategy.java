package com.ccflow.analyzer.correlate;

import com.ccflow.analyzer.model.HttpCall;
import com.ccflow.analyzer.model.Segment;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 默认泳道划分：
 * - namespace=aws    : DynamoDB / S3 / SNS / SQS，其余带 operation 的用段名，否则 AWS
 * - remote / 有 http  : 按配置的 host 片段归类，其次 HTTP，没有 URL 时 Remote
 * - 其他             : 段名，没有就是 Unknown
 */
@Component
public class DefaultServiceKeyStrategy implements ServiceKeyStrategy {

    private static final List<String> AWS_SERVICES = List.of("DynamoDB", "S3", "SNS", "SQS");

    @Override
    public String resolve(Segment segment, TraceConfig config) {
        if (segment == null) {
            return "Unknown";
        }
        String name = segment.getName();

        if ("aws".equals(segment.getNamespace())) {
            if (name != null) {
                for (String service : AWS_SERVICES) {
                    if (name.contains(service)) {
                        return service;
                    }
                }
            }
            if (segment.getAwsOperation() != null) {
                return name == null || name.isBlank() ? "AWS" : name;
            }
            return "AWS";
        }

        HttpCall http = segment.getHttp();
        if ("remote".equals(segment.getNamespace()) || http != null) {
            String url = http == null ? null : http.getUrl();
            if (url == null || url.isBlank()) {
                return "Remote";
            }
            Map<String, String> hosts = config == null ? Map.of() : config.getServiceHosts();
            for (Map.Entry<String, String> host : hosts.entrySet()) {
                if (url.contains(host.getKey())) {
                    return host.getValue();
                }
            }
            return "HTTP";
        }

        return name == null || name.isBlank() ? "Unknown" : name;
    }
}
