package com.postpilot.connector.service;

import com.postpilot.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the connected-account token cache. Tokens are written and refreshed by the
 * auth service under {@code <platform>:token:<destinationAccountId>}.
 */
@Service
@RequiredArgsConstructor
public class AccessTokenStore {

    private final StringRedisTemplate redisTemplate;

    public Optional<String> findToken(Platform platform, UUID destinationAccountId) {
        String cacheKey = platform.name().toLowerCase() + ":token:" + destinationAccountId;
        return Optional.ofNullable(redisTemplate.opsForValue().get(cacheKey))
                .filter(token -> !token.isBlank());
    }
}
