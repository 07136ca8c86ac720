package com.graphqldemo.graphql.registry;

import com.graphqldemo.auth.security.Role;
import graphql.schema.DataFetcher;

import java.util.Set;

/**
 * 一个 GraphQL 字段处理器及其访问要求。
 *
 * @param typeName      所属类型（Query / Mutation / 对象类型）
 * @param fieldName     字段名
 * @param requiredRoles 满足其一即可访问；为空表示公开
 * @param dataFetcher   处理器
 */
public record GraphQlOperation(
        String typeName,
        String fieldName,
        Set<Role> requiredRoles,
        DataFetcher<?> dataFetcher
) {
    public GraphQlOperation {
        requiredRoles = Set.copyOf(requiredRoles);
    }

    public boolean isPublic() {
        return requiredRoles.isEmpty();
    }
}
