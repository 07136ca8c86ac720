package com.graphqldemo.post.service;

import com.graphqldemo.auth.security.AuthenticatedUser;
import com.graphqldemo.common.page.PageResult;
import com.graphqldemo.post.model.Post;
import com.graphqldemo.post.model.PostFilter;
import com.graphqldemo.post.model.PostOrder;

import java.util.List;
import java.util.Optional;

/**
 * 帖子业务接口。所有写操作在返回前失效所属用户的帖子缓存。
 */
public interface PostService {

    Post createPost(String ownerUserId, String content);

    Post updatePost(String postId, String newContent, AuthenticatedUser actor);

    boolean deletePost(String postId, AuthenticatedUser actor);

    /**
     * 读穿缓存：命中直接返回，未命中从库中按创建时间倒序加载并写入缓存。
     */
    List<Post> getUserPosts(String userId);

    Optional<Post> findById(String postId);

    PageResult<Post> search(PostFilter filter, PostOrder order, int offset, int limit);
}
