package com.graphqldemo.auth.api.dto;

import com.graphqldemo.common.validation.MaxUtf8Bytes;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 注册请求。
 * <p>
 * 字段：用户名（3~50 位）、邮箱（合法格式）、密码（至少 6 位，UTF-8 编码不超过 72 字节，即 BCrypt 的输入上限）。
 * 所有违规一起返回，而不是只报告第一个。
 */
public record RegisterInput(
        @NotBlank(message = "Username must not be empty.")
        @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters.")
        String username,

        @NotBlank(message = "Email must not be empty.")
        @Email(regexp = "^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$",
                message = "Email must be a valid email address.")
        String email,

        @NotBlank(message = "Password must not be empty.")
        @Size(min = 6, message = "Password must be at least 6 characters.")
        @MaxUtf8Bytes(value = 72, message = "Password must be at most 72 bytes.")
        String password
) {
}
