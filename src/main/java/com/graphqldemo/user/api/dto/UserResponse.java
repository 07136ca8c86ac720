package com.graphqldemo.user.api.dto;

import com.graphqldemo.user.domain.User;

import java.time.Instant;

/**
 * 面向客户端的用户信息，不含密码哈希。
 */
public record UserResponse(
        String id,
        String username,
        String email,
        String role,
        Instant createdAt
) {
    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getEmail(), user.getRole(), user.getCreatedAt());
    }
}
