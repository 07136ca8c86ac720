package com.graphqldemo.auth.audit;

import com.graphqldemo.auth.model.ClientInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LoginLogService {

    public static final String CHANNEL_REGISTER = "REGISTER";
    public static final String CHANNEL_PASSWORD = "PASSWORD";
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILED = "FAILED";

    private final LoginLogMapper loginLogMapper;
    private final Clock clock;

    /**
     * 记录一次登录/注册事件。使用独立事务，外层失败回滚时审计记录仍保留。
     *
     * @param userId     用户 ID，账号不存在时为 null。
     * @param identifier 登录/注册使用的邮箱。
     * @param channel    渠道：REGISTER/PASSWORD。
     * @param client     客户端 IP 与 UA。
     * @param status     结果：SUCCESS/FAILED。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(String userId, String identifier, String channel, ClientInfo client, String status) {
        LoginLog log = LoginLog.builder()
                .userId(userId)
                .identifier(identifier)
                .channel(channel)
                .ip(client.ip())
                .userAgent(client.userAgent())
                .status(status)
                .createdAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .build();
        loginLogMapper.insert(log);
    }

    @Transactional(readOnly = true)
    public List<LoginLog> history(String identifier) {
        return loginLogMapper.listByIdentifier(identifier);
    }
}
