package com.graphqldemo.post.api.dto;

public record UpdatePostInput(String postId, String newContent) {
}
