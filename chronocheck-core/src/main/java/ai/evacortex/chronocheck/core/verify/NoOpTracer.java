/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import ai.evacortex.chronocheck.core.model.StateSpace;

import java.time.Duration;

public class NoOpTracer implements VerificationTracer {
    @Override
    public void stateSpaceBuilt(String document, StateSpace space, Duration elapsed) {
        // no-op
    }

    @Override
    public void propertyChecked(String document, PropertyResult result) {
        // no-op
    }
}
