package com.graphqldemo.graphql.registry;

import com.graphqldemo.auth.exception.BusinessException;
import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.security.AuthenticatedUser;
import com.graphqldemo.auth.security.CurrentUserResolver;
import com.graphqldemo.auth.security.Role;
import graphql.schema.DataFetcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 字段级访问控制：未认证报 UNAUTHENTICATED，角色不满足报 FORBIDDEN。
 */
@Component
@RequiredArgsConstructor
public class AccessGuard {

    private final CurrentUserResolver currentUserResolver;

    public void check(Set<Role> requiredRoles) {
        if (requiredRoles.isEmpty()) {
            return;
        }
        AuthenticatedUser user = currentUserResolver.require();
        if (!user.satisfiesAny(requiredRoles)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Role " + user.role().getValue() + " is not allowed to perform this operation.");
        }
    }

    public DataFetcher<?> secure(GraphQlOperation operation) {
        if (operation.isPublic()) {
            return operation.dataFetcher();
        }
        DataFetcher<?> delegate = operation.dataFetcher();
        return env -> {
            check(operation.requiredRoles());
            return delegate.get(env);
        };
    }
}
