package com.flagship.currency_gateway.security;

import com.flagship.currency_gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves caller API keys to the bank they act for.
 *
 * Keys live in Redis as {@code {prefix}{apiKey} -> bankName}. They are
 * provisioned by a separate tool; this service only reads them.
 */
@Service
@Slf4j
public class ApiKeyRegistry {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public ApiKeyRegistry(StringRedisTemplate redisTemplate, GatewayProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.auth().apiKeyPrefix();
    }

    /**
     * @return the bank name bound to the key, or empty for an unknown key
     * @throws org.springframework.dao.DataAccessException if Redis cannot be reached
     */
    public Optional<String> resolveBankName(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Optional.empty();
        }
        String bankName = redisTemplate.opsForValue().get(keyPrefix + apiKey);
        if (bankName == null || bankName.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(bankName);
    }
}
