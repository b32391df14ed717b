package com.ccflow.analyzer;

import com.ccflow.analyzer.config.FlowAnalyzerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FlowAnalyzerProperties.class)
public class CallFlowAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallFlowAnalyzerApplication.class, args);
    }
}
