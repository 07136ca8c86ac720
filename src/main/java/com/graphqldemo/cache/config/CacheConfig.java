package com.graphqldemo.cache.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.graphqldemo.cache.CaffeineUserPostsCache;
import com.graphqldemo.cache.UserPostsCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public UserPostsCache userPostsCache(CacheProperties props) {
        return new CaffeineUserPostsCache(props.getUserPosts().getMaxSize(), Ticker.systemTicker());
    }
}
