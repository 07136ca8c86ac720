package com.graphqldemo.post.service.impl;

import com.graphqldemo.auth.exception.BusinessException;
import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.exception.ValidationException;
import com.graphqldemo.auth.security.AuthenticatedUser;
import com.graphqldemo.cache.UserPostsCache;
import com.graphqldemo.cache.config.CacheProperties;
import com.graphqldemo.common.page.PageResult;
import com.graphqldemo.post.mapper.PostMapper;
import com.graphqldemo.post.model.Post;
import com.graphqldemo.post.model.PostFilter;
import com.graphqldemo.post.model.PostOrder;
import com.graphqldemo.post.service.PostService;
import com.graphqldemo.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostServiceImpl implements PostService {

    static final int MAX_CONTENT_LENGTH = 4000;

    private final PostMapper mapper;
    private final UserService userService;
    private final UserPostsCache userPostsCache;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    /**
     * 创建帖子，服务端分配 ID 与创建时间，写入后失效作者的缓存。
     */
    @Transactional
    public Post createPost(String ownerUserId, String content) {
        String normalized = validateContent("content", content);
        if (userService.findById(ownerUserId).isEmpty()) {
            throw new BusinessException(ErrorCode.NOT_FOUND, "User not found.");
        }
        Post post = Post.builder()
                .id(UUID.randomUUID().toString())
                .content(normalized)
                .createdAt(now())
                .userId(ownerUserId)
                .build();
        mapper.insert(post);
        invalidateUserPosts(ownerUserId);
        log.info("Post {} created by user {}", post.getId(), ownerUserId);
        return post;
    }

    /**
     * 更新内容与更新时间。帖子不存在时直接报 NOT_FOUND，不触碰缓存。
     */
    @Transactional
    public Post updatePost(String postId, String newContent, AuthenticatedUser actor) {
        Post post = requireOwnedPost(postId, actor);
        String normalized = validateContent("newContent", newContent);
        post.setContent(normalized);
        post.setUpdatedAt(now());
        int updated = mapper.updateContent(post);
        if (updated == 0) {
            throw new BusinessException(ErrorCode.NOT_FOUND, "Post not found.");
        }
        invalidateUserPosts(post.getUserId());
        log.info("Post {} updated by user {}", postId, actor.userId());
        return post;
    }

    /**
     * 删除帖子。帖子不存在时直接报 NOT_FOUND，不触碰缓存。
     */
    @Transactional
    public boolean deletePost(String postId, AuthenticatedUser actor) {
        Post post = requireOwnedPost(postId, actor);
        int deleted = mapper.deleteById(postId);
        if (deleted == 0) {
            throw new BusinessException(ErrorCode.NOT_FOUND, "Post not found.");
        }
        invalidateUserPosts(post.getUserId());
        log.info("Post {} deleted by user {}", postId, actor.userId());
        return true;
    }

    @Transactional(readOnly = true)
    public List<Post> getUserPosts(String userId) {
        Optional<List<Post>> cached = userPostsCache.get(userId);
        if (cached.isPresent()) {
            log.debug("userPosts source=cache user={}", userId);
            return cached.get();
        }
        long generation = userPostsCache.generation(userId);
        List<Post> posts = mapper.listByUserId(userId);
        boolean stored = userPostsCache.put(userId, posts, cacheProperties.getUserPosts().getTtl(), generation);
        log.debug("userPosts source=db user={} size={} cached={}", userId, posts.size(), stored);
        return List.copyOf(posts);
    }

    @Transactional(readOnly = true)
    public Optional<Post> findById(String postId) {
        return Optional.ofNullable(mapper.findById(postId));
    }

    @Transactional(readOnly = true)
    public PageResult<Post> search(PostFilter filter, PostOrder order, int offset, int limit) {
        PostFilter safeFilter = filter == null ? PostFilter.none() : filter;
        PostOrder safeOrder = order == null ? PostOrder.defaultOrder() : order;
        long total = mapper.count(safeFilter);
        List<Post> posts = mapper.search(safeFilter, safeOrder, limit, offset);
        return new PageResult<>(posts, offset, total);
    }

    private Post requireOwnedPost(String postId, AuthenticatedUser actor) {
        Post post = mapper.findById(postId);
        if (post == null) {
            throw new BusinessException(ErrorCode.NOT_FOUND, "Post not found.");
        }
        if (!actor.isAdmin() && !actor.userId().equals(post.getUserId())) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Only the owner can modify this post.");
        }
        return post;
    }

    private String validateContent(String field, String content) {
        if (!StringUtils.hasText(content)) {
            throw ValidationException.ofField(ErrorCode.VALIDATION_FAILED, field, "Content must not be empty.");
        }
        String trimmed = content.trim();
        if (trimmed.length() > MAX_CONTENT_LENGTH) {
            throw ValidationException.ofField(ErrorCode.VALIDATION_FAILED, field,
                    "Content must be at most " + MAX_CONTENT_LENGTH + " characters.");
        }
        return trimmed;
    }

    /**
     * 写后立即删除缓存；若处于事务中，提交后再删一次。两次删除都会推进代数，
     * 期间开始的回源结果写回时被拒绝。
     */
    private void invalidateUserPosts(String userId) {
        userPostsCache.evict(userId);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    userPostsCache.evict(userId);
                }
            });
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
