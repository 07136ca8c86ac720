package com.graphqldemo.post.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 帖子列表过滤条件，字段均可为空。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostFilter {
    private String userId;
    private String contentContains;
    /** 包含边界。 */
    private Instant createdAfter;
    /** 不含边界。 */
    private Instant createdBefore;

    public static PostFilter none() {
        return new PostFilter();
    }
}
