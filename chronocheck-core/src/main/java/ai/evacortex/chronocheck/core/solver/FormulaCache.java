/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shared cache of solver results keyed by normalized formula text.
 *
 * <p>Each key is computed at most once while it is resident: concurrent callers for the same
 * key wait for the first computation and observe the same result. Entries are never replaced.
 * Eviction only happens past {@code maxEntries}, and a recomputed entry is identical because
 * every solver input is deterministic.</p>
 */
public class FormulaCache {

    public static final String MAX_ENTRIES_PROPERTY = "chronocheck.cache.maxEntries";

    private final Cache<String, SatisfiabilityResult> cache;

    public FormulaCache() {
        this(Integer.getInteger(MAX_ENTRIES_PROPERTY, 10_000));
    }

    public FormulaCache(int maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build();
    }

    public SatisfiabilityResult get(String key, Supplier<SatisfiabilityResult> loader) {
        return cache.get(key, k -> loader.get());
    }

    public Optional<SatisfiabilityResult> getIfPresent(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
