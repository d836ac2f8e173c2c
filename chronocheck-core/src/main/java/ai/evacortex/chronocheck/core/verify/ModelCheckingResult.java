/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import java.util.List;
import java.util.Optional;

public record ModelCheckingResult(List<PropertyResult> properties, VerificationStatus status, ModelCheckingStats stats) {

    public ModelCheckingResult {
        properties = List.copyOf(properties);
    }

    public Optional<PropertyResult> property(String name) {
        return properties.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
