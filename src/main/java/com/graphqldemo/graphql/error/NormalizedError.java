package com.graphqldemo.graphql.error;

import org.springframework.graphql.execution.ErrorType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对外错误格式：message + extensions。
 */
public record NormalizedError(String message, ErrorType errorType, Map<String, Object> extensions) {

    public NormalizedError {
        extensions = Map.copyOf(extensions);
    }

    /**
     * GraphQL 响应中 errors[] 单个元素的 JSON 结构，用于 GraphQL 执行之外（如 HTTP 401）直接写出。
     */
    public Map<String, Object> toSpecification() {
        Map<String, Object> ext = new LinkedHashMap<>(extensions);
        ext.put("classification", errorType.name());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("extensions", ext);
        return body;
    }
}
