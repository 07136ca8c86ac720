package com.graphqldemo.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 认证相关配置属性，绑定前缀 {@code auth.*}。
 *
 * <p>包含以下分组：</p>
 * - Jwt：令牌签发与验证配置；
 * - Password：密码加密强度配置。
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** JWT 配置项。 */
    private final Jwt jwt = new Jwt();
    /** 密码配置项。 */
    private final Password password = new Password();

    @Data
    public static class Jwt {
        /** JWT 签发者标识（iss）。 */
        private String issuer = "graphql-demo";
        /** HMAC-SHA256 对称密钥，至少 32 字节。 */
        private String secret;
        /** 令牌有效期，无刷新令牌，到期后只能重新登录。 */
        private Duration tokenTtl = Duration.ofHours(24);
    }

    /** 密码策略配置。 */
    @Data
    public static class Password {
        /** 密码哈希强度（BCrypt cost）。 */
        private int bcryptStrength = 10;
    }
}
