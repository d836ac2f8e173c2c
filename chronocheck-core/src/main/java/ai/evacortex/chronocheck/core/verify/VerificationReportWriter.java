/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import ai.evacortex.chronocheck.core.analysis.OperatorValidationResult;
import ai.evacortex.chronocheck.core.engine.CounterexampleTrace;
import ai.evacortex.chronocheck.core.engine.FixpointStats;
import ai.evacortex.chronocheck.core.engine.WitnessTrace;
import ai.evacortex.chronocheck.core.model.StateSpaceAnalysis;
import ai.evacortex.chronocheck.core.pattern.PatternAnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link VerificationReport} as pretty-printed JSON. Durations are written as
 * milliseconds.
 */
public class VerificationReportWriter {

    private final ObjectMapper mapper = new ObjectMapper();

    record PropertyJson(String name, String formula, String outcome, String reason, String engine,
                        CounterexampleTrace counterexample, WitnessTrace witness,
                        List<FixpointStats> fixpoints, long elapsedMillis) {}

    record StatsJson(int statesExplored, int transitionsExplored, int verified, int failed, int unknown,
                     int errors, Map<String, Long> timingsMillis, long totalMillis) {}

    record ReportJson(String document, OperatorValidationResult operators, PatternAnalysisResult patterns,
                      int states, int transitions, boolean trivialStateSpace, boolean truncatedStateSpace,
                      StateSpaceAnalysis stateSpace, String status, List<PropertyJson> properties,
                      StatsJson stats) {}

    public String toJson(VerificationReport report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(view(report));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize report for " + report.document(), e);
        }
    }

    public void write(VerificationReport report, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, view(report));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write report " + file, e);
        }
    }

    static ReportJson view(VerificationReport report) {
        ModelCheckingResult mc = report.modelChecking();
        List<PropertyJson> properties = new ArrayList<>();
        for (PropertyResult p : mc.properties()) {
            properties.add(new PropertyJson(p.name(), p.formula(), p.outcome().name(), p.result().reason(),
                    p.engine().name(), p.counterexample(), p.witness(), p.fixpoints(), p.elapsed().toMillis()));
        }
        ModelCheckingStats s = mc.stats();
        Map<String, Long> timings = new LinkedHashMap<>();
        s.timings().forEach((k, v) -> timings.put(k, v.toMillis()));
        StatsJson stats = new StatsJson(s.statesExplored(), s.transitionsExplored(), s.verified(), s.failed(),
                s.unknown(), s.errors(), timings, s.totalTime().toMillis());
        return new ReportJson(report.document(), report.operators(), report.patterns(), report.states(),
                report.transitions(), report.trivialStateSpace(), report.truncatedStateSpace(),
                report.stateSpace(), mc.status().name(), properties, stats);
    }
}
