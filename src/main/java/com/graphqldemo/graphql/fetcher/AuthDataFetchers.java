package com.graphqldemo.graphql.fetcher;

import com.graphqldemo.auth.api.dto.LoginInput;
import com.graphqldemo.auth.api.dto.RegisterInput;
import com.graphqldemo.auth.security.CurrentUserResolver;
import com.graphqldemo.auth.service.AuthService;
import com.graphqldemo.user.api.dto.UserResponse;
import graphql.schema.DataFetcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 注册、登录与当前用户。
 */
@Component
@RequiredArgsConstructor
public class AuthDataFetchers {

    private final AuthService authService;
    private final CurrentUserResolver currentUserResolver;
    private final GraphQlArguments arguments;

    public DataFetcher<UserResponse> register() {
        return env -> authService.register(arguments.bind(env, "input", RegisterInput.class), arguments.clientInfo(env));
    }

    public DataFetcher<String> login() {
        return env -> authService.login(arguments.bind(env, "input", LoginInput.class), arguments.clientInfo(env));
    }

    public DataFetcher<UserResponse> me() {
        return env -> authService.me(currentUserResolver.require().userId());
    }
}
