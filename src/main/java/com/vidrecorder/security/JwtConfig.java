package com.vidrecorder.security;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@Getter
@Slf4j
public class JwtConfig {

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.header:Authorization}")
    private String headerName;

    @Value("${jwt.prefix:Bearer }")
    private String tokenPrefix;

    @Value("${jwt.expiration:12h}")
    private Duration expiration;

    @PostConstruct
    void validateConfig() {
        if (secret == null || secret.isBlank() || secret.startsWith("${")) {
            throw new IllegalStateException(
                    "JWT_SECRET environment variable is not set. "
                    + "Set it to the signing secret shared with the room service: export JWT_SECRET=<secret>");
        }
        if (secret.length() < 32) {
            throw new IllegalStateException("JWT secret must be at least 32 characters for HS256");
        }
    }
}
