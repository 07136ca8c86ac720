package com.graphqldemo.graphql.logging;

import com.graphqldemo.auth.model.ClientInfo;
import com.graphqldemo.auth.security.AuthenticatedUser;
import com.graphqldemo.auth.security.CurrentUserResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 请求日志：调用者、操作文档、耗时与结果；并把客户端信息放入 GraphQL 上下文供审计使用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphQlRequestLoggingInterceptor implements WebGraphQlInterceptor {

    private final CurrentUserResolver currentUserResolver;

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        ClientInfo clientInfo = ClientInfo.from(request.getHeaders());
        request.configureExecutionInput((executionInput, builder) ->
                builder.graphQLContext(context -> context.put(ClientInfo.class, clientInfo)).build());

        String caller = currentUserResolver.current().map(AuthenticatedUser::email).orElse("Anonymous");
        String document = request.getDocument().replaceAll("\\s+", " ").trim();
        long start = System.nanoTime();
        return chain.next(request)
                .doOnNext(response -> {
                    boolean success = response.isValid() && response.getErrors().isEmpty();
                    log.info("GraphQL [{}] caller={} ip={} elapsed={}ms result={}", document, caller,
                            clientInfo.ip(), elapsedMs(start), success ? "Success" : "Fail");
                })
                .doOnError(ex -> log.info("GraphQL [{}] caller={} ip={} elapsed={}ms result=Fail", document, caller,
                        clientInfo.ip(), elapsedMs(start)));
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
