package com.graphqldemo.graphql.fetcher;

import com.graphqldemo.user.api.dto.AuthorResponse;
import com.graphqldemo.user.domain.User;
import com.graphqldemo.user.service.UserService;
import org.springframework.graphql.execution.BatchLoaderRegistry;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按用户 ID 批量加载作者公开信息，一次请求内的 Post.author 合并为一条查询。
 */
@Component
public class AuthorBatchLoaderRegistrar {

    public static final String AUTHOR_LOADER = AuthorResponse.class.getName();

    public AuthorBatchLoaderRegistrar(BatchLoaderRegistry registry, UserService userService) {
        registry.forTypePair(String.class, AuthorResponse.class)
                .registerMappedBatchLoader((ids, env) -> Mono.fromCallable(() -> {
                    Map<String, AuthorResponse> result = new LinkedHashMap<>();
                    for (Map.Entry<String, User> entry : userService.findByIds(ids).entrySet()) {
                        result.put(entry.getKey(), AuthorResponse.from(entry.getValue()));
                    }
                    return result;
                }));
    }
}
