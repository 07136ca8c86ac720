package com.graphqldemo.user.api.dto;

import com.graphqldemo.user.domain.User;

import java.time.Instant;

/**
 * 帖子作者的公开信息，匿名可见，因此不含邮箱。
 */
public record AuthorResponse(String id, String username, Instant createdAt) {

    public static AuthorResponse from(User user) {
        return new AuthorResponse(user.getId(), user.getUsername(), user.getCreatedAt());
    }
}
