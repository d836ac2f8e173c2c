/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FormulaCacheTest {

    @Test
    void testGet_computesOnceAndReturnsSameInstance() {
        FormulaCache cache = new FormulaCache(100);
        AtomicInteger loads = new AtomicInteger();

        SatisfiabilityResult first = cache.get("ltl:a", () -> {
            loads.incrementAndGet();
            return SatisfiabilityResult.unknown("first");
        });
        SatisfiabilityResult second = cache.get("ltl:a", () -> {
            loads.incrementAndGet();
            return SatisfiabilityResult.unknown("second");
        });

        assertSame(first, second);
        assertEquals(1, loads.get());
        assertEquals(1, cache.size());
        assertTrue(cache.getIfPresent("ltl:a").isPresent());
        assertTrue(cache.getIfPresent("ltl:b").isEmpty());
    }

    @Test
    void testConcurrentCallers_observeOneComputation() throws Exception {
        FormulaCache cache = new FormulaCache(100);
        AtomicInteger loads = new AtomicInteger();
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<SatisfiabilityResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.get("bmc:shared", () -> {
                        loads.incrementAndGet();
                        try {
                            Thread.sleep(50);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return SatisfiabilityResult.error("slow");
                    });
                }));
            }
            start.countDown();
            SatisfiabilityResult expected = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<SatisfiabilityResult> f : futures) {
                assertSame(expected, f.get(10, TimeUnit.SECONDS), "all callers must see the cached instance");
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, loads.get(), "loader must run exactly once");
    }

    @Test
    void testGet_laterLoadersNeverReplaceAnEntry() {
        FormulaCache cache = new FormulaCache(10);
        SatisfiabilityResult original = cache.get("k", () -> SatisfiabilityResult.unknown("original"));

        for (int i = 0; i < 5; i++) {
            SatisfiabilityResult seen = cache.get("k", () -> {
                throw new AssertionError("a resident key must not be recomputed");
            });
            assertSame(original, seen);
        }
        assertSame(original, cache.getIfPresent("k").orElseThrow());
        assertEquals(1, cache.size());
    }
}
