package com.graphqldemo.graphql;

import com.graphqldemo.auth.security.Role;
import com.graphqldemo.graphql.fetcher.AuthDataFetchers;
import com.graphqldemo.graphql.fetcher.PostDataFetchers;
import com.graphqldemo.graphql.fetcher.UserDataFetchers;
import com.graphqldemo.graphql.registry.AccessGuard;
import com.graphqldemo.graphql.registry.GraphQlOperation;
import com.graphqldemo.graphql.registry.GraphQlOperationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.graphql.execution.RuntimeWiringConfigurer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * GraphQL 字段处理器登记与装配。
 * <p>
 * 每个字段在此显式列出其处理器与所需角色；未列出的字段走默认属性读取。
 */
@Slf4j
@Configuration
public class GraphQlWiringConfig {

    @Bean
    public GraphQlOperationRegistry graphQlOperationRegistry(AuthDataFetchers auth,
                                                             UserDataFetchers users,
                                                             PostDataFetchers posts) {
        return GraphQlOperationRegistry.builder()
                .mutation("register", auth.register())
                .mutation("login", auth.login())
                .mutation("createPost", posts.createPost(), Role.USER)
                .mutation("updatePost", posts.updatePost(), Role.USER)
                .mutation("deletePost", posts.deletePost(), Role.USER)
                .query("me", auth.me(), Role.USER)
                .query("users", users.users(), Role.USER)
                .query("posts", posts.posts())
                .query("post", posts.post())
                .query("userPosts", posts.userPosts())
                .field("User", "posts", users.posts())
                .field("Post", "author", posts.author())
                .build();
    }

    @Bean
    public RuntimeWiringConfigurer runtimeWiringConfigurer(GraphQlOperationRegistry registry, AccessGuard accessGuard) {
        Map<String, List<GraphQlOperation>> byType = registry.operations().stream()
                .collect(Collectors.groupingBy(GraphQlOperation::typeName, LinkedHashMap::new, Collectors.toList()));
        return wiringBuilder -> byType.forEach((typeName, operations) -> {
            wiringBuilder.type(typeName, builder -> {
                for (GraphQlOperation operation : operations) {
                    builder.dataFetcher(operation.fieldName(), accessGuard.secure(operation));
                }
                return builder;
            });
            log.info("Wired {} GraphQL fields on {}", operations.size(), typeName);
        });
    }
}
