package com.codehive.MPBS.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Date;

// Tokens revoked by logout; entries expire together with the token
@Slf4j
@Service
public class TokenDenylistService {

    static final String KEY_PREFIX = "auth:revoked:";

    @Autowired
    private RedisTemplate<String, Object> redisTemplate;

    public void revoke(String token, Date expiresAt) {
        long ttlMs = expiresAt.getTime() - System.currentTimeMillis();
        if (ttlMs <= 0) {
            return; // already expired, nothing left to revoke
        }
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + token, "REVOKED", Duration.ofMillis(ttlMs));
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, token stays valid until it expires: {}", e.getMessage());
        }
    }

    public boolean isRevoked(String token) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + token));
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, cannot check token revocation: {}", e.getMessage());
            return false;
        }
    }
}
