package com.graphqldemo.graphql.fetcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.exception.ValidationException;
import com.graphqldemo.auth.model.ClientInfo;
import graphql.schema.DataFetchingEnvironment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 把 GraphQL 参数绑定为输入对象。
 */
@Component
@RequiredArgsConstructor
public class GraphQlArguments {

    private final ObjectMapper objectMapper;

    /**
     * @return 参数缺省时返回 null。
     * @throws ValidationException 参数值无法转换（如时间格式错误）时抛出，字段为参数名。
     */
    public <T> T bind(DataFetchingEnvironment env, String name, Class<T> type) {
        Object raw = env.getArgument(name);
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(raw, type);
        } catch (IllegalArgumentException ex) {
            throw ValidationException.ofField(ErrorCode.VALIDATION_FAILED, name, "Invalid value.");
        }
    }

    public ClientInfo clientInfo(DataFetchingEnvironment env) {
        return env.getGraphQlContext().getOrDefault(ClientInfo.class, ClientInfo.UNKNOWN);
    }
}
