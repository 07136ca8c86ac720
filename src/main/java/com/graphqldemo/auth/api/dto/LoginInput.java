package com.graphqldemo.auth.api.dto;

/**
 * 登录请求：邮箱 + 密码。
 */
public record LoginInput(
        String email,
        String password
) {
}
