package com.graphqldemo.auth.security;

import java.util.Set;

/**
 * 从已校验的令牌中解析出的调用者身份。
 *
 * @param userId 用户 ID（JWT sub）
 * @param email  邮箱（JWT email 声明）
 * @param role   角色（JWT role 声明）
 */
public record AuthenticatedUser(String userId, String email, Role role) {

    public boolean satisfiesAny(Set<Role> required) {
        return required.isEmpty() || required.stream().anyMatch(role::implies);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
