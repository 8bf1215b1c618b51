package com.al.clinicalnormalizer.config;

import com.al.clinicalnormalizer.service.terminology.CacheTtlPolicy;
import com.al.clinicalnormalizer.service.terminology.LocalTerminologyCache;
import com.al.clinicalnormalizer.service.terminology.RedisTerminologyCache;
import com.al.clinicalnormalizer.service.terminology.TerminologyCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Terminology cache configuration.
 *
 * <p>
 * Backends:
 * <ul>
 * <li>LOCAL: in-process Guava cache, one per instance (default)</li>
 * <li>REDIS: shared cache, JSON values with per-key TTL</li>
 * </ul>
 * Successful resolutions and fallbacks use separate TTLs; see {@link NormalizerProperties}.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public Ticker terminologyCacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public CacheTtlPolicy cacheTtlPolicy(NormalizerProperties properties) {
        return new CacheTtlPolicy(properties.getCacheTtlPositive(), properties.getCacheTtlNegative());
    }

    @Bean
    public TerminologyCache terminologyCache(NormalizerProperties properties, CacheTtlPolicy ttlPolicy,
            Ticker terminologyCacheTicker, ObjectProvider<StringRedisTemplate> redisTemplate,
            ObjectMapper objectMapper) {
        if (properties.getCacheBackend() == NormalizerProperties.CacheBackend.REDIS) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                log.info("Using Redis terminology cache (ttl positive={}, negative={})",
                        ttlPolicy.getPositiveTtl(), ttlPolicy.getNegativeTtl());
                return new RedisTerminologyCache(template, objectMapper, ttlPolicy);
            }
            log.warn("Redis cache backend requested but no Redis connection is configured, using local cache");
        }
        log.info("Using local terminology cache (max size={}, ttl positive={}, negative={})",
                properties.getCacheMaximumSize(), ttlPolicy.getPositiveTtl(), ttlPolicy.getNegativeTtl());
        return new LocalTerminologyCache(ttlPolicy, properties.getCacheMaximumSize(), terminologyCacheTicker);
    }
}
