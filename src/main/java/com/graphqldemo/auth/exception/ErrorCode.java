package com.graphqldemo.auth.exception;

import lombok.Getter;

/**
 * 错误类别。服务层抛出的每个业务异常都携带一个错误码，由错误归一化器统一映射为对外格式。
 */
@Getter
public enum ErrorCode {
    VALIDATION_FAILED("VALIDATION_FAILED", "Validation failed."),
    DUPLICATE_EMAIL("DUPLICATE_EMAIL", "Email is already in use."),
    DUPLICATE_USERNAME("DUPLICATE_USERNAME", "Username is already taken."),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", "Invalid credentials."),
    NOT_FOUND("NOT_FOUND", "Resource not found."),
    UNAUTHENTICATED("UNAUTHENTICATED", "Authentication is required."),
    FORBIDDEN("FORBIDDEN", "Access denied."),
    INTERNAL_ERROR("INTERNAL_ERROR", "Internal server error.");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
