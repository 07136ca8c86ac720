package com.graphqldemo.auth.service;

import com.graphqldemo.auth.api.dto.LoginInput;
import com.graphqldemo.auth.api.dto.RegisterInput;
import com.graphqldemo.auth.audit.LoginLogService;
import com.graphqldemo.auth.exception.BusinessException;
import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.exception.ValidationException;
import com.graphqldemo.auth.model.ClientInfo;
import com.graphqldemo.auth.security.Role;
import com.graphqldemo.auth.token.IssuedToken;
import com.graphqldemo.auth.token.JwtService;
import com.graphqldemo.common.validation.InputValidator;
import com.graphqldemo.user.api.dto.UserResponse;
import com.graphqldemo.user.domain.User;
import com.graphqldemo.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * 认证业务服务。
 * <p>
 * 职责：注册、登录、查询当前用户信息。
 * 安全策略：
 * - 注册输入先去空格、邮箱转小写，再一次性聚合校验（用户名长度、邮箱格式、密码长度）；
 * - 邮箱、用户名唯一，插入前检查，插入时由唯一索引兜底；
 * - 登录失败不区分“账号不存在”与“密码错误”，账号不存在时同样执行一次哈希比对。
 * 审计：记录注册/登录成功与失败，包含 IP 与 UA。
 * 令牌：签发 HS256 会话令牌，携带 sub、email、role，24 小时过期。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserService userService;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final LoginLogService loginLogService;
    private final InputValidator inputValidator;

    private volatile String dummyHash;

    /**
     * 注册用户。
     *
     * @param input      注册请求，包含：用户名、邮箱、密码。
     * @param clientInfo 客户端信息（IP/UA），用于审计。
     * @return 新用户信息（不含密码哈希）。
     * @throws ValidationException 当输入不合法（VALIDATION_FAILED）或邮箱/用户名已存在
     *                             （DUPLICATE_EMAIL / DUPLICATE_USERNAME）时抛出。
     */
    public UserResponse register(RegisterInput input, ClientInfo clientInfo) {
        RegisterInput normalized = new RegisterInput(
                input.username() == null ? null : input.username().trim(),
                normalizeEmail(input.email()),
                input.password());
        inputValidator.validate(normalized);
        String email = normalized.email();
        String username = normalized.username();

        if (userService.existsByEmail(email)) {
            log.warn("Registration failed: email {} is already in use", email);
            throw duplicateEmail();
        }
        if (userService.existsByUsername(username)) {
            log.warn("Registration failed: username {} is already taken", username);
            throw duplicateUsername();
        }

        log.info("Registering user with email: {}", email);
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .username(username)
                .email(email)
                .passwordHash(passwordEncoder.encode(input.password()))
                .role(Role.USER.getValue())
                .build();
        try {
            userService.createUser(user);
        } catch (DuplicateKeyException ex) {
            // 并发注册：检查通过后被其他请求抢先插入
            throw userService.existsByEmail(email) ? duplicateEmail() : duplicateUsername();
        }
        loginLogService.record(user.getId(), email, LoginLogService.CHANNEL_REGISTER, clientInfo, LoginLogService.STATUS_SUCCESS);
        return UserResponse.from(user);
    }

    /**
     * 密码登录并签发会话令牌。
     *
     * @param input      登录请求，包含：邮箱、密码。
     * @param clientInfo 客户端信息（IP/UA），用于审计。
     * @return 令牌字符串。
     * @throws BusinessException 账号不存在或密码错误时统一抛出 INVALID_CREDENTIALS。
     */
    public String login(LoginInput input, ClientInfo clientInfo) {
        String email = normalizeEmail(input.email());
        String password = input.password() == null ? "" : input.password();
        Optional<User> userOptional = email.isEmpty() ? Optional.empty() : userService.findByEmail(email);

        boolean matches;
        if (userOptional.isPresent()) {
            matches = passwordEncoder.matches(password, userOptional.get().getPasswordHash());
        } else {
            passwordEncoder.matches(password, dummyHash());
            matches = false;
        }
        if (!matches) {
            String userId = userOptional.map(User::getId).orElse(null);
            loginLogService.record(userId, email, LoginLogService.CHANNEL_PASSWORD, clientInfo, LoginLogService.STATUS_FAILED);
            log.warn("Login failed for {}", email);
            throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
        }

        User user = userOptional.get();
        IssuedToken token = jwtService.issueToken(user);
        loginLogService.record(user.getId(), email, LoginLogService.CHANNEL_PASSWORD, clientInfo, LoginLogService.STATUS_SUCCESS);
        log.info("User {} logged in, token expires at {}", user.getId(), token.expiresAt());
        return token.token();
    }

    /**
     * 查询用户概要信息。
     *
     * @param userId 用户 ID。
     * @return 用户概要响应。
     * @throws BusinessException 当用户不存在时抛出 NOT_FOUND。
     */
    public UserResponse me(String userId) {
        return userService.findById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.NOT_FOUND, "User not found."));
    }

    /**
     * 标准化邮箱：去空格并转小写。
     */
    private String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = passwordEncoder.encode(UUID.randomUUID().toString());
            dummyHash = hash;
        }
        return hash;
    }

    private static ValidationException duplicateEmail() {
        return ValidationException.ofField(ErrorCode.DUPLICATE_EMAIL, "email", ErrorCode.DUPLICATE_EMAIL.getDefaultMessage());
    }

    private static ValidationException duplicateUsername() {
        return ValidationException.ofField(ErrorCode.DUPLICATE_USERNAME, "username", ErrorCode.DUPLICATE_USERNAME.getDefaultMessage());
    }
}
