package com.graphqldemo.auth.token;

import com.graphqldemo.auth.config.AuthProperties;
import com.graphqldemo.auth.security.AuthenticatedUser;
import com.graphqldemo.auth.security.Role;
import com.graphqldemo.user.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * JWT 令牌服务。
 * <p>
 * 功能：签发会话令牌（HS256），解码 JWT，提取调用者身份。
 * 声明：
 * - `sub`：用户 ID；
 * - `email`：邮箱；
 * - `role`：角色（User / Admin）；
 * - `jti`：令牌 ID。
 * 过期时间：签发时间 + `AuthProperties.jwt.tokenTtl`（默认 24 小时）。无吊销列表，到期即失效。
 */
@Service
@RequiredArgsConstructor
public class JwtService {

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * 为指定用户签发会话令牌。
     *
     * @param user 用户实体。
     * @return 令牌字符串及过期时间。
     */
    public IssuedToken issueToken(User user) {
        Instant issuedAt = Instant.now(clock);
        Instant expiresAt = issuedAt.plus(properties.getJwt().getTokenTtl());
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(properties.getJwt().getIssuer())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .subject(user.getId())
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole())
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * 解码并校验 JWT（签名、签发者、过期时间）。
     *
     * @param token JWT 字符串。
     * @return 解析后的 JWT 对象。
     * @throws org.springframework.security.oauth2.jwt.JwtException 校验失败时抛出。
     */
    public Jwt decode(String token) {
        return jwtDecoder.decode(token);
    }

    /**
     * 从已校验的 JWT 中提取调用者身份。
     *
     * @param jwt 已解析的 JWT。
     * @return 调用者身份。
     * @throws IllegalArgumentException 当角色声明缺失或非法时抛出。
     */
    public AuthenticatedUser toAuthenticatedUser(Jwt jwt) {
        String role = jwt.getClaimAsString(CLAIM_ROLE);
        if (role == null) {
            throw new IllegalArgumentException("Missing role in token");
        }
        return new AuthenticatedUser(jwt.getSubject(), jwt.getClaimAsString(CLAIM_EMAIL), Role.fromValue(role));
    }
}
