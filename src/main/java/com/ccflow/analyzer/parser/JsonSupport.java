package com.ccflow.analyzer.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 脱离 Spring 使用时的 ObjectMapper，配置和 Boot 自动配置出来的保持一致。
 */
public final class JsonSupport {

    private JsonSupport() {
    }

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
