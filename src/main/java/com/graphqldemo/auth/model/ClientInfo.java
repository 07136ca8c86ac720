package com.graphqldemo.auth.model;

import org.springframework.http.HttpHeaders;

/**
 * 客户端信息：IP 与 User-Agent，用于登录审计。
 */
public record ClientInfo(String ip, String userAgent) {

    public static final ClientInfo UNKNOWN = new ClientInfo("unknown", null);

    /**
     * 从请求头解析客户端信息。
     * <p>
     * 优先使用代理头：`X-Forwarded-For`（取第一个）、`X-Real-IP`；否则记为 unknown。
     *
     * @param headers 请求头。
     * @return 客户端信息。
     */
    public static ClientInfo from(HttpHeaders headers) {
        String ip = "unknown";
        String forwarded = headers.getFirst("X-Forwarded-For");
        String realIp = headers.getFirst("X-Real-IP");
        if (forwarded != null && !forwarded.isBlank()) {
            ip = forwarded.split(",")[0].trim();
        } else if (realIp != null && !realIp.isBlank()) {
            ip = realIp.trim();
        }
        return new ClientInfo(ip, headers.getFirst(HttpHeaders.USER_AGENT));
    }
}
