package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.model.ResolvedTerm;

import java.util.function.Supplier;

/**
 * Cache in front of the concept catalogue.
 *
 * <p>
 * Implementations throw {@link com.al.clinicalnormalizer.exception.CacheBackendUnavailableException}
 * when the cache itself cannot be used; callers then compute the term directly.
 */
public interface TerminologyCache {

    /**
     * Return the cached term for the key, computing and storing it when absent or expired.
     * Concurrent callers for the same key share one computation where the backend allows it.
     */
    ResolvedTerm getOrCompute(TerminologyCacheKey key, Supplier<ResolvedTerm> loader);

    /**
     * Drop every cached term, e.g. after a catalogue import.
     */
    void invalidateAll();
}
