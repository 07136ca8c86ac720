package com.graphqldemo.auth.security;

import java.util.Arrays;

/**
 * 用户角色。ADMIN 隐含 USER，持久化与令牌声明均使用 {@link #getValue()}。
 */
public enum Role {
    USER("User"),
    ADMIN("Admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 当前角色是否满足所需角色（自身或通过层级继承）。
     */
    public boolean implies(Role required) {
        return this == required || this == ADMIN;
    }

    public static Role fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
