package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.exception.CacheBackendUnavailableException;
import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Terminology cache shared between instances through Redis. Terms are stored as JSON
 * with a per-key expiry from the {@link CacheTtlPolicy}.
 */
@Slf4j
public class RedisTerminologyCache implements TerminologyCache {

    private static final String KEY_PATTERN = "terminology:*";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CacheTtlPolicy ttlPolicy;

    public RedisTerminologyCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            CacheTtlPolicy ttlPolicy) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttlPolicy = ttlPolicy;
    }

    @Override
    public ResolvedTerm getOrCompute(TerminologyCacheKey key, Supplier<ResolvedTerm> loader) {
        String redisKey = key.asString();
        String json;
        try {
            json = redisTemplate.opsForValue().get(redisKey);
        } catch (RuntimeException e) {
            throw new CacheBackendUnavailableException("Redis read failed for " + redisKey, e);
        }

        if (json != null) {
            try {
                return objectMapper.readValue(json, ResolvedTerm.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Discarding unreadable cache entry {}: {}", redisKey, e.getMessage());
            }
        }

        ResolvedTerm term = loader.get();
        Duration ttl = ttlPolicy.ttlFor(term);
        if (!ttl.isZero()) {
            write(redisKey, term, ttl);
        }
        return term;
    }

    @Override
    public void invalidateAll() {
        try {
            Set<String> keys = redisTemplate.keys(KEY_PATTERN);
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.info("Invalidated {} cached terms in Redis", keys.size());
            }
        } catch (RuntimeException e) {
            throw new CacheBackendUnavailableException("Redis invalidation failed", e);
        }
    }

    private void write(String redisKey, ResolvedTerm term, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(redisKey, objectMapper.writeValueAsString(term), ttl);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize term for {}: {}", redisKey, e.getMessage());
        } catch (RuntimeException e) {
            // The term is already computed; a failed write only costs a future miss
            log.warn("Redis write failed for {}: {}", redisKey, e.getMessage());
        }
    }
}
