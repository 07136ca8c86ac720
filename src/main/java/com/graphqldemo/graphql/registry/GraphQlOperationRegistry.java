package com.graphqldemo.graphql.registry;

import com.graphqldemo.auth.security.Role;
import graphql.schema.DataFetcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 启动时显式登记的全部 GraphQL 字段处理器，按 "类型.字段" 唯一。
 */
public final class GraphQlOperationRegistry {

    public static final String QUERY = "Query";
    public static final String MUTATION = "Mutation";

    private final Map<String, GraphQlOperation> operations;

    private GraphQlOperationRegistry(Map<String, GraphQlOperation> operations) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<GraphQlOperation> operations() {
        return List.copyOf(operations.values());
    }

    public Optional<GraphQlOperation> find(String typeName, String fieldName) {
        return Optional.ofNullable(operations.get(key(typeName, fieldName)));
    }

    private static String key(String typeName, String fieldName) {
        return typeName + "." + fieldName;
    }

    public static final class Builder {

        private final Map<String, GraphQlOperation> operations = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder query(String fieldName, DataFetcher<?> fetcher, Role... requiredRoles) {
            return field(QUERY, fieldName, fetcher, requiredRoles);
        }

        public Builder mutation(String fieldName, DataFetcher<?> fetcher, Role... requiredRoles) {
            return field(MUTATION, fieldName, fetcher, requiredRoles);
        }

        public Builder field(String typeName, String fieldName, DataFetcher<?> fetcher, Role... requiredRoles) {
            GraphQlOperation operation = new GraphQlOperation(typeName, fieldName, Set.of(requiredRoles), fetcher);
            GraphQlOperation previous = operations.putIfAbsent(key(typeName, fieldName), operation);
            if (previous != null) {
                throw new IllegalStateException("Duplicate GraphQL operation: " + key(typeName, fieldName));
            }
            return this;
        }

        public GraphQlOperationRegistry build() {
            return new GraphQlOperationRegistry(operations);
        }
    }
}
