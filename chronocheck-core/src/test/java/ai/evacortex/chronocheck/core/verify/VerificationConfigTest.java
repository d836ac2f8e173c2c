/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import ai.evacortex.chronocheck.core.model.ModelLimits;
import ai.evacortex.chronocheck.core.solver.SolverConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerificationConfigTest {

    @TempDir Path tempDir;

    @Test
    void testLoad_fullFile() throws URISyntaxException {
        Path path = Path.of(getClass().getResource("/config/verification.json").toURI());

        VerificationConfig c = VerificationConfig.load(path);

        assertEquals(Duration.ofMillis(2500), c.solver().timeout());
        assertEquals(50, c.solver().maxModelSize());
        assertFalse(c.solver().enableQuantifierInstantiation());
        assertFalse(c.solver().enableTheoryReasoning());
        assertEquals(Map.of("random_seed", "7"), c.solver().solverOptions());
        assertEquals(16, c.solver().maxBound());
        assertEquals(new ModelLimits(500), c.limits());
        assertEquals(3, c.parallelism());
        assertEquals(64, c.cacheMaxEntries());
    }

    @Test
    void testLoad_absentKeysKeepDefaults() throws IOException {
        Path path = tempDir.resolve("partial.json");
        Files.writeString(path, "{\"maxBound\": 8, \"comment\": \"ignored\"}");

        VerificationConfig c = VerificationConfig.load(path);
        VerificationConfig d = VerificationConfig.defaults();

        assertEquals(8, c.solver().maxBound());
        assertEquals(d.solver().timeout(), c.solver().timeout());
        assertEquals(d.limits(), c.limits());
        assertEquals(d.parallelism(), c.parallelism());
        assertEquals(d.cacheMaxEntries(), c.cacheMaxEntries());
    }

    @Test
    void testLoad_failuresAreWrapped() throws IOException {
        Path garbage = tempDir.resolve("garbage.json");
        Files.writeString(garbage, "{ not json");

        RuntimeException bad = assertThrows(RuntimeException.class, () -> VerificationConfig.load(garbage));
        assertTrue(bad.getMessage().startsWith("Failed to load verification config"));
        assertInstanceOf(IOException.class, bad.getCause());

        assertThrows(RuntimeException.class, () -> VerificationConfig.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testDefaults_honourSystemProperty() {
        String previous = System.getProperty(VerificationConfig.PARALLELISM_PROPERTY);
        System.setProperty(VerificationConfig.PARALLELISM_PROPERTY, "2");
        try {
            assertEquals(2, VerificationConfig.defaults().parallelism());
        } finally {
            if (previous == null) System.clearProperty(VerificationConfig.PARALLELISM_PROPERTY);
            else System.setProperty(VerificationConfig.PARALLELISM_PROPERTY, previous);
        }
    }

    @Test
    void testConstructor_rejectsBadValues() {
        SolverConfig solver = SolverConfig.defaults();
        assertThrows(IllegalArgumentException.class,
                () -> new VerificationConfig(solver, ModelLimits.defaults(), 0, 10));
        assertThrows(IllegalArgumentException.class,
                () -> new VerificationConfig(solver, ModelLimits.defaults(), 1, -1));
        assertThrows(NullPointerException.class,
                () -> new VerificationConfig(null, ModelLimits.defaults(), 1, 10));
    }

    @Test
    void testWithers_replaceOneField() {
        VerificationConfig base = VerificationConfig.defaults();
        VerificationConfig changed = base.withParallelism(7).withLimits(new ModelLimits(42));

        assertEquals(7, changed.parallelism());
        assertEquals(42, changed.limits().maxStates());
        assertEquals(base.solver(), changed.solver());
    }
}
