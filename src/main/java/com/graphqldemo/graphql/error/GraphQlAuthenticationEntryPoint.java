package com.graphqldemo.graphql.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphqldemo.auth.exception.BusinessException;
import com.graphqldemo.auth.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Bearer 令牌无效或过期时的 401 响应。
 * <p>
 * 状态码与 WWW-Authenticate 头由 {@link BearerTokenAuthenticationEntryPoint} 设置，
 * 响应体经错误归一化器写成 GraphQL errors[] 格式。
 */
@Component
@RequiredArgsConstructor
public class GraphQlAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final GraphQlErrorNormalizer errorNormalizer;
    private final ObjectMapper objectMapper;
    private final BearerTokenAuthenticationEntryPoint delegate = new BearerTokenAuthenticationEntryPoint();

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        delegate.commence(request, response, authException);
        NormalizedError error = errorNormalizer.normalize(
                new BusinessException(ErrorCode.UNAUTHENTICATED, authException.getMessage()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), Map.of("errors", List.of(error.toSpecification())));
    }
}
