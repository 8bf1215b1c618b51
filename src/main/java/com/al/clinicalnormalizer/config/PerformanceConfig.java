package com.al.clinicalnormalizer.config;

import ca.uhn.fhir.context.FhirContext;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Performance optimization: singleton FHIR context and the worker pools used by the
 * pipeline and the concept store.
 */
@Configuration
public class PerformanceConfig {

    /**
     * Singleton FHIR R4 context - thread-safe and reusable
     * Creating FhirContext is expensive (~1-2 seconds), so we create it once
     */
    @Bean
    public FhirContext fhirContext() {
        FhirContext ctx = FhirContext.forR4();
        ctx.getParserOptions().setStripVersionsFromReferences(false);
        ctx.getParserOptions().setOverrideResourceIdWithBundleEntryFullUrl(false);
        return ctx;
    }

    /**
     * Bounded pool running one task per section extractor.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService extractionExecutor(NormalizerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
                new ThreadFactoryBuilder().setNameFormat("section-extractor-%d").setDaemon(true).build());
    }

    /**
     * Pool used to bound catalogue lookups with a timeout.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService lookupExecutor(NormalizerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getWorkerThreads() * 2),
                new ThreadFactoryBuilder().setNameFormat("terminology-lookup-%d").setDaemon(true).build());
    }
}
