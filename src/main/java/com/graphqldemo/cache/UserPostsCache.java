package com.graphqldemo.cache;

import com.graphqldemo.post.model.Post;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 按用户缓存其帖子列表（最新在前）。
 * <p>
 * 每个用户有一个代数：{@link #evict} 使其前进。回源前先读取代数，写回时代数已变则放弃写入，
 * 这样与写操作重叠的回源结果不会进入缓存。移除不存在的键是空操作；并发未命中时允许重复回源。
 */
public interface UserPostsCache {

    Optional<List<Post>> get(String userId);

    /**
     * 当前代数，回源读库之前调用。
     */
    long generation(String userId);

    /**
     * 代数仍为 expectedGeneration 时写入，ttl 为滑动窗口：每次读取都会重新计时。
     *
     * @return 是否写入。
     */
    boolean put(String userId, List<Post> posts, Duration ttl, long expectedGeneration);

    void evict(String userId);
}
