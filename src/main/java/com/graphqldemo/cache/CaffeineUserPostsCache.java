package com.graphqldemo.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.graphqldemo.post.model.Post;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Caffeine 的本地实现。每个条目自带 ttl，创建、覆盖、读取时都以该 ttl 重新计时。
 * <p>
 * 代数取自全局递增序列，代数表被淘汰后重建的值也不会与旧值相同；
 * 条件写入与失效都在同一键的 compute 中完成，彼此串行。
 * 存入和取出的都是帖子副本。
 */
public class CaffeineUserPostsCache implements UserPostsCache {

    private final Cache<String, Entry> cache;
    private final Cache<String, Long> generations;
    private final AtomicLong sequence = new AtomicLong();

    public CaffeineUserPostsCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new SlidingExpiry())
                .executor(Runnable::run)
                .build();
        this.generations = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<List<Post>> get(String userId) {
        Entry entry = cache.getIfPresent(userId);
        return entry == null ? Optional.empty() : Optional.of(copyOf(entry.posts()));
    }

    @Override
    public long generation(String userId) {
        return generations.get(userId, key -> sequence.incrementAndGet());
    }

    @Override
    public boolean put(String userId, List<Post> posts, Duration ttl, long expectedGeneration) {
        Entry fresh = new Entry(copyOf(posts), ttl);
        Entry stored = cache.asMap().compute(userId, (key, current) ->
                currentGeneration(key) == expectedGeneration ? fresh : current);
        return stored == fresh;
    }

    @Override
    public void evict(String userId) {
        cache.asMap().compute(userId, (key, current) -> {
            generations.put(key, sequence.incrementAndGet());
            return null;
        });
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private long currentGeneration(String userId) {
        Long generation = generations.getIfPresent(userId);
        return generation == null ? -1 : generation;
    }

    private static List<Post> copyOf(List<Post> posts) {
        return posts.stream().map(post -> post.toBuilder().build()).toList();
    }

    private record Entry(List<Post> posts, Duration ttl) {
    }

    private static final class SlidingExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }
    }
}
