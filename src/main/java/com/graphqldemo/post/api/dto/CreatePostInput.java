package com.graphqldemo.post.api.dto;

public record CreatePostInput(String content) {
}
