package com.graphqldemo.graphql.fetcher;

import com.graphqldemo.auth.security.CurrentUserResolver;
import com.graphqldemo.common.page.PageResult;
import com.graphqldemo.graphql.pagination.Connection;
import com.graphqldemo.graphql.pagination.ConnectionSupport;
import com.graphqldemo.graphql.pagination.PageRequest;
import com.graphqldemo.post.api.dto.CreatePostInput;
import com.graphqldemo.post.api.dto.UpdatePostInput;
import com.graphqldemo.post.model.Post;
import com.graphqldemo.post.model.PostFilter;
import com.graphqldemo.post.model.PostOrder;
import com.graphqldemo.post.service.PostService;
import com.graphqldemo.user.api.dto.AuthorResponse;
import graphql.schema.DataFetcher;
import lombok.RequiredArgsConstructor;
import org.dataloader.DataLoader;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 帖子查询与写操作。
 */
@Component
@RequiredArgsConstructor
public class PostDataFetchers {

    private final PostService postService;
    private final CurrentUserResolver currentUserResolver;
    private final GraphQlArguments arguments;
    private final ConnectionSupport connectionSupport;

    public DataFetcher<Connection<Post>> posts() {
        return env -> {
            PageRequest page = connectionSupport.pageRequest(env);
            PostFilter filter = arguments.bind(env, "filter", PostFilter.class);
            PostOrder order = arguments.bind(env, "order", PostOrder.class);
            return connectionSupport.toConnection(postService.search(filter, order, page.offset(), page.limit()));
        };
    }

    public DataFetcher<Post> post() {
        return env -> postService.findById(env.getArgument("id")).orElse(null);
    }

    public DataFetcher<Connection<Post>> userPosts() {
        return env -> userPostsConnection(env.getArgument("userId"), connectionSupport.pageRequest(env));
    }

    public DataFetcher<Post> createPost() {
        return env -> {
            CreatePostInput input = arguments.bind(env, "input", CreatePostInput.class);
            return postService.createPost(currentUserResolver.require().userId(), input.content());
        };
    }

    public DataFetcher<Post> updatePost() {
        return env -> {
            UpdatePostInput input = arguments.bind(env, "input", UpdatePostInput.class);
            return postService.updatePost(input.postId(), input.newContent(), currentUserResolver.require());
        };
    }

    public DataFetcher<Boolean> deletePost() {
        return env -> postService.deletePost(env.getArgument("postId"), currentUserResolver.require());
    }

    /**
     * Post.author，经 DataLoader 批量解析。
     */
    public DataFetcher<CompletableFuture<AuthorResponse>> author() {
        return env -> {
            Post post = env.getSource();
            DataLoader<String, AuthorResponse> loader = env.getDataLoader(AuthorBatchLoaderRegistrar.AUTHOR_LOADER);
            return loader.load(post.getUserId());
        };
    }

    Connection<Post> userPostsConnection(String userId, PageRequest page) {
        PageResult<Post> result = PageResult.slice(postService.getUserPosts(userId), page.offset(), page.limit());
        return connectionSupport.toConnection(result);
    }
}
