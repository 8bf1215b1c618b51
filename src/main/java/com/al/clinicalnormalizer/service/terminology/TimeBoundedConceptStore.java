package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.exception.ConceptStoreException;
import com.al.clinicalnormalizer.model.ConceptRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator that bounds every catalogue call with a timeout. A slow or hung backend
 * surfaces as a {@link ConceptStoreException} instead of blocking an extraction worker.
 */
@Slf4j
public class TimeBoundedConceptStore implements ConceptStore {

    private final ConceptStore delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeBoundedConceptStore(ConceptStore delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public Optional<ConceptRecord> findConcept(String code, String codeSystemOid) {
        return call("findConcept", () -> delegate.findConcept(code, codeSystemOid));
    }

    @Override
    public Optional<ConceptRecord> findConceptInValueSet(String code, String valueSetOid) {
        return call("findConceptInValueSet", () -> delegate.findConceptInValueSet(code, valueSetOid));
    }

    @Override
    public Optional<String> findTranslation(ConceptRecord concept, String language, String country) {
        return call("findTranslation", () -> delegate.findTranslation(concept, language, country));
    }

    private <T> T call(String operation, Callable<T> lookup) {
        Future<T> future;
        try {
            future = executor.submit(lookup);
        } catch (RejectedExecutionException e) {
            throw new ConceptStoreException("Lookup executor rejected " + operation, e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Catalogue {} exceeded {} ms", operation, timeout.toMillis());
            throw new ConceptStoreException("Catalogue " + operation + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConceptStoreException("Interrupted during catalogue " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConceptStoreException) {
                throw (ConceptStoreException) cause;
            }
            throw new ConceptStoreException("Catalogue " + operation + " failed", cause);
        }
    }
}
