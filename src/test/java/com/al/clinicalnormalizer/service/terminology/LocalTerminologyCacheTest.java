package com.al.clinicalnormalizer.service.terminology;

import com.al.clinicalnormalizer.model.ResolvedTerm;
import com.al.clinicalnormalizer.model.enums.FallbackReason;
import com.al.clinicalnormalizer.model.enums.Provenance;
import com.al.clinicalnormalizer.support.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class LocalTerminologyCacheTest {

    private static final TerminologyCacheKey KEY = new TerminologyCacheKey("2.16.840.1.113883.6.96", "260176001",
            "en", null);

    private ManualTicker ticker;
    private LocalTerminologyCache cache;
    private AtomicInteger loads;

    @BeforeEach
    public void setUp() {
        ticker = new ManualTicker();
        cache = new LocalTerminologyCache(new CacheTtlPolicy(Duration.ofHours(1), Duration.ofMinutes(5)), 100,
                ticker);
        loads = new AtomicInteger();
    }

    @Test
    public void testGetOrCompute_ResolvedTermKeptForPositiveTtl() {
        cache.getOrCompute(KEY, () -> counted(resolved()));
        ticker.advance(Duration.ofMinutes(59));
        cache.getOrCompute(KEY, () -> counted(resolved()));

        assertEquals(1, loads.get());

        ticker.advance(Duration.ofMinutes(2));
        cache.getOrCompute(KEY, () -> counted(resolved()));

        assertEquals(2, loads.get());
    }

    @Test
    public void testGetOrCompute_FallbackExpiresAfterNegativeTtl() {
        cache.getOrCompute(KEY, () -> counted(fallback(FallbackReason.CONCEPT_NOT_FOUND)));
        ticker.advance(Duration.ofMinutes(4));
        cache.getOrCompute(KEY, () -> counted(fallback(FallbackReason.CONCEPT_NOT_FOUND)));

        assertEquals(1, loads.get());

        ticker.advance(Duration.ofMinutes(2));
        ResolvedTerm refreshed = cache.getOrCompute(KEY, () -> counted(resolved()));

        assertEquals(2, loads.get());
        assertEquals(Provenance.DEFAULT_DISPLAY, refreshed.getProvenance());
    }

    @Test
    public void testGetOrCompute_LookupFailureNotRetained() {
        ResolvedTerm failed = cache.getOrCompute(KEY, () -> counted(fallback(FallbackReason.LOOKUP_FAILED)));
        ResolvedTerm next = cache.getOrCompute(KEY, () -> counted(resolved()));

        assertEquals(FallbackReason.LOOKUP_FAILED, failed.getFallbackReason());
        assertEquals("Kiwi fruit", next.getDisplay());
        assertEquals(2, loads.get());
    }

    @Test
    public void testGetOrCompute_LoaderExceptionPropagates() {
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> cache.getOrCompute(KEY, () -> {
                    throw new IllegalStateException("catalogue exploded");
                }));

        assertEquals("catalogue exploded", thrown.getMessage());
        assertEquals(0, cache.size());
    }

    @Test
    public void testGetOrCompute_ConcurrentMissesLoadOnce() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ResolvedTerm>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return cache.getOrCompute(KEY, () -> {
                        sleepQuietly(100);
                        return counted(resolved());
                    });
                }));
            }
            start.countDown();
            for (Future<ResolvedTerm> future : futures) {
                assertEquals("Kiwi fruit", future.get(5, TimeUnit.SECONDS).getDisplay());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, loads.get());
    }

    @Test
    public void testInvalidateAll() {
        cache.getOrCompute(KEY, () -> counted(resolved()));
        cache.invalidateAll();
        cache.getOrCompute(KEY, () -> counted(resolved()));

        assertEquals(2, loads.get());
    }

    @Test
    public void testKeys_CountryDistinguishesEntries() {
        TerminologyCacheKey brazil = new TerminologyCacheKey("2.16.840.1.113883.6.96", "260176001", "pt", "BR");
        TerminologyCacheKey portugal = new TerminologyCacheKey("2.16.840.1.113883.6.96", "260176001", "pt", "PT");

        cache.getOrCompute(brazil, () -> counted(resolved()));
        cache.getOrCompute(portugal, () -> counted(resolved()));

        assertEquals(2, loads.get());
        assertEquals("terminology:2.16.840.1.113883.6.96:260176001:en:-", KEY.asString());
    }

    private ResolvedTerm counted(ResolvedTerm term) {
        loads.incrementAndGet();
        return term;
    }

    private static ResolvedTerm resolved() {
        return ResolvedTerm.builder()
                .code("260176001")
                .codeSystemOid("2.16.840.1.113883.6.96")
                .codeSystemName("SNOMED CT")
                .display("Kiwi fruit")
                .provenance(Provenance.DEFAULT_DISPLAY)
                .build();
    }

    private static ResolvedTerm fallback(FallbackReason reason) {
        return ResolvedTerm.builder()
                .code("260176001")
                .codeSystemOid("2.16.840.1.113883.6.96")
                .codeSystemName("SNOMED CT")
                .display("Code: 260176001 (System: 2.16.840.1.113883.6.96)")
                .provenance(Provenance.FALLBACK)
                .fallbackReason(reason)
                .build();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
