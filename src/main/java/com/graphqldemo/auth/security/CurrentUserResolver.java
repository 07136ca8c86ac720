package com.graphqldemo.auth.security;

import com.graphqldemo.auth.exception.BusinessException;
import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.token.JwtService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 从 Spring Security 上下文解析当前调用者。只有携带有效 Bearer 令牌的请求才视为已认证。
 */
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    private final JwtService jwtService;

    public Optional<AuthenticatedUser> current() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken token && token.isAuthenticated()) {
            return Optional.of(jwtService.toAuthenticatedUser(token.getToken()));
        }
        return Optional.empty();
    }

    /**
     * @throws BusinessException 未认证时抛出 UNAUTHENTICATED。
     */
    public AuthenticatedUser require() {
        return current().orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHENTICATED));
    }
}
