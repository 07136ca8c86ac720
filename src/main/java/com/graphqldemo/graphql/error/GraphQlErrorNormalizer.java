package com.graphqldemo.graphql.error;

import com.graphqldemo.auth.exception.BusinessException;
import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.exception.ValidationException;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * GraphQL 错误归一化器。
 * <p>
 * 所有数据获取过程中抛出的异常都经过这里转换为统一格式：
 * - {@link ValidationException}："Validation failed."，extensions.validationErrors 为字段 -> 信息列表；
 * - 其他异常："Unexpected error occurred."，extensions.errorType 为错误码（业务异常）或异常类名，
 *   extensions.details 为异常信息。
 */
@Slf4j
@Component
public class GraphQlErrorNormalizer extends DataFetcherExceptionResolverAdapter {

    public static final String VALIDATION_MESSAGE = "Validation failed.";
    public static final String UNEXPECTED_MESSAGE = "Unexpected error occurred.";

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        NormalizedError error = normalize(ex);
        return GraphqlErrorBuilder.newError(env)
                .message(error.message())
                .errorType(error.errorType())
                .extensions(error.extensions())
                .build();
    }

    public NormalizedError normalize(Throwable ex) {
        Throwable cause = unwrap(ex);
        if (cause instanceof ValidationException validation) {
            log.warn("Validation failed [{}]: {}", validation.getErrorCode().getCode(), validation.getErrors());
            return new NormalizedError(VALIDATION_MESSAGE, ErrorType.BAD_REQUEST,
                    Map.of("validationErrors", validation.getErrors()));
        }

        Map<String, Object> extensions = new LinkedHashMap<>();
        ErrorType errorType;
        if (cause instanceof BusinessException business) {
            log.warn("Business error [{}]: {}", business.getErrorCode().getCode(), business.getMessage());
            extensions.put("errorType", business.getErrorCode().getCode());
            errorType = classify(business.getErrorCode());
        } else {
            log.error("Unhandled exception", cause);
            extensions.put("errorType", cause.getClass().getSimpleName());
            errorType = ErrorType.INTERNAL_ERROR;
        }
        extensions.put("details", cause.getMessage() == null ? "" : cause.getMessage());
        return new NormalizedError(UNEXPECTED_MESSAGE, errorType, extensions);
    }

    private ErrorType classify(ErrorCode code) {
        return switch (code) {
            case VALIDATION_FAILED, DUPLICATE_EMAIL, DUPLICATE_USERNAME, INVALID_CREDENTIALS -> ErrorType.BAD_REQUEST;
            case UNAUTHENTICATED -> ErrorType.UNAUTHORIZED;
            case FORBIDDEN -> ErrorType.FORBIDDEN;
            case NOT_FOUND -> ErrorType.NOT_FOUND;
            case INTERNAL_ERROR -> ErrorType.INTERNAL_ERROR;
        };
    }

    private Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
