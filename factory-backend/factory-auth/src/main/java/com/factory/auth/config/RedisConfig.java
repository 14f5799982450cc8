package com.factory.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis Configuration for the refresh-token session store.
 * <p>
 * Values are plain strings, so Boot's auto-configured {@code StringRedisTemplate} is used as is.
 * Rotation needs GET-compare-SET as one step; Redis runs a Lua script atomically, so two refreshes
 * presenting the same token cannot both win.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisScript<Long> refreshRotateScript() {
        return RedisScript.of(
                new ClassPathResource("scripts/refresh_rotate.lua"),
                Long.class
        );
    }
}
