package com.graphqldemo.post.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Post {
    private String id;
    private String content;
    private Instant createdAt;
    /** 未更新过时为 null。 */
    private Instant updatedAt;
    /** 所属用户 ID。 */
    private String userId;
}
