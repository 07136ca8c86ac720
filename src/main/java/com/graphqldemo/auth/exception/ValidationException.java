package com.graphqldemo.auth.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 字段级校验失败。
 * <p>
 * 所有违规按字段聚合（字段名 -> 错误信息列表），一次性返回给客户端，而不是只报告第一个。
 * 邮箱/用户名重复也以该异常表达，错误码分别为 DUPLICATE_EMAIL / DUPLICATE_USERNAME。
 */
@Getter
public class ValidationException extends BusinessException {

    private final Map<String, List<String>> errors;

    public ValidationException(Map<String, List<String>> errors) {
        this(ErrorCode.VALIDATION_FAILED, errors);
    }

    public ValidationException(ErrorCode errorCode, Map<String, List<String>> errors) {
        super(errorCode, ErrorCode.VALIDATION_FAILED.getDefaultMessage());
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        this.errors = Collections.unmodifiableMap(copy);
    }

    public static ValidationException ofField(ErrorCode errorCode, String field, String message) {
        return new ValidationException(errorCode, Map.of(field, List.of(message)));
    }
}
