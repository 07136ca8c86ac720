package com.graphqldemo.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户列表过滤条件，字段均可为空。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserFilter {
    private String usernameContains;
    private String emailContains;
    private String role;

    public static UserFilter none() {
        return new UserFilter();
    }
}
