package com.graphqldemo.graphql.fetcher;

import com.graphqldemo.graphql.pagination.Connection;
import com.graphqldemo.graphql.pagination.ConnectionSupport;
import com.graphqldemo.graphql.pagination.PageRequest;
import com.graphqldemo.post.model.Post;
import com.graphqldemo.user.api.dto.UserResponse;
import com.graphqldemo.user.domain.UserFilter;
import com.graphqldemo.user.domain.UserOrder;
import com.graphqldemo.user.service.UserService;
import graphql.schema.DataFetcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserDataFetchers {

    private final UserService userService;
    private final GraphQlArguments arguments;
    private final ConnectionSupport connectionSupport;
    private final PostDataFetchers postDataFetchers;

    public DataFetcher<Connection<UserResponse>> users() {
        return env -> {
            PageRequest page = connectionSupport.pageRequest(env);
            UserFilter filter = arguments.bind(env, "filter", UserFilter.class);
            UserOrder order = arguments.bind(env, "order", UserOrder.class);
            return connectionSupport.toConnection(
                    userService.search(filter, order, page.offset(), page.limit()), UserResponse::from);
        };
    }

    /**
     * User.posts，与 userPosts 共用缓存。
     */
    public DataFetcher<Connection<Post>> posts() {
        return env -> {
            UserResponse user = env.getSource();
            return postDataFetchers.userPostsConnection(user.id(), connectionSupport.pageRequest(env));
        };
    }
}
