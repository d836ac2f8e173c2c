/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

import java.util.*;

/**
 * @param valuation  variable name to value, in variable declaration order
 * @param locations  names of the functions enabled in this state
 * @param properties atomic propositions that hold in this state
 */
public record SystemState(int id, Map<String, Value> valuation, Set<String> locations, Set<String> properties) {

    public SystemState {
        valuation = Collections.unmodifiableMap(new LinkedHashMap<>(valuation));
        locations = Collections.unmodifiableSet(new LinkedHashSet<>(locations));
        properties = Collections.unmodifiableSet(new LinkedHashSet<>(properties));
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "s" + id + "{", "}");
        valuation.forEach((k, v) -> sj.add(k + "=" + v.literal()));
        return sj.toString();
    }
}
