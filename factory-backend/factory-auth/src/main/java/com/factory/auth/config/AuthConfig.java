package com.factory.auth.config;

import com.factory.auth.domain.service.BCryptPasswordHasher;
import com.factory.auth.domain.service.PasswordHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
@Slf4j
public class AuthConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordHasher passwordHasher(AuthProperties properties) {
        log.info("[PASSWORD_HASHER_INIT] BCrypt password hasher | cost={}", properties.getBcryptCost());
        return new BCryptPasswordHasher(properties.getBcryptCost());
    }
}
