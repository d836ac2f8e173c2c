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

/**
 * Observability hook for verification runs. Called from worker threads.
 */
public interface VerificationTracer {

    void stateSpaceBuilt(String document, StateSpace space, Duration elapsed);

    void propertyChecked(String document, PropertyResult result);
}
