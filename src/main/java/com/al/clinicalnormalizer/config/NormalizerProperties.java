package com.al.clinicalnormalizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for terminology resolution and section extraction.
 */
@Data
@ConfigurationProperties(prefix = "app.normalizer")
public class NormalizerProperties {

    /**
     * Language used for catalogue translations (ISO 639-1).
     */
    private String targetLanguage = "en";

    /**
     * Optional country (ISO 3166-1 alpha-2) for country-specific translations.
     */
    private String targetCountry;

    /**
     * How long a successfully resolved term stays cached.
     */
    private Duration cacheTtlPositive = Duration.ofHours(1);

    /**
     * How long a fallback term stays cached. Kept short so that catalogue updates
     * surface quickly.
     */
    private Duration cacheTtlNegative = Duration.ofMinutes(5);

    /**
     * Upper bound on locally cached terms.
     */
    private long cacheMaximumSize = 50_000;

    /**
     * Cache implementation backing the resolver.
     */
    private CacheBackend cacheBackend = CacheBackend.LOCAL;

    /**
     * Maximum time a single catalogue lookup may take before the resolver falls back.
     */
    private Duration lookupTimeout = Duration.ofSeconds(2);

    /**
     * Number of worker threads extracting sections in parallel.
     */
    private int workerThreads = 4;

    public enum CacheBackend {
        /**
         * In-process Guava cache
         */
        LOCAL,

        /**
         * Shared Redis cache
         */
        REDIS
    }
}
