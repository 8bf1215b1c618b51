package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.FallbackReason;
import lombok.Value;

import java.time.Duration;

/**
 * Chooses how long a resolved term may be cached. Lookup failures are never retained so
 * that a recovered backend is consulted on the next request.
 */
@Value
public class CacheTtlPolicy {
    Duration positiveTtl;
    Duration negativeTtl;

    public Duration ttlFor(ResolvedTerm term) {
        if (term.isResolved()) {
            return positiveTtl;
        }
        if (term.getFallbackReason() == FallbackReason.LOOKUP_FAILED) {
            return Duration.ZERO;
        }
        return negativeTtl;
    }

    public Duration longest() {
        return positiveTtl.compareTo(negativeTtl) >= 0 ? positiveTtl : negativeTtl;
    }
}
