package com.graphqldemo.cache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "cache")
@Data
public class CacheProperties {
    private UserPosts userPosts = new UserPosts();

    @Data
    public static class UserPosts {
        /** 滑动过期窗口。 */
        private Duration ttl = Duration.ofMinutes(5);
        private long maxSize = 10_000;
    }
}
