/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

import ai.evacortex.chronocheck.core.analysis.AnalysisIssue;
import ai.evacortex.chronocheck.core.analysis.OperatorInstance;
import ai.evacortex.chronocheck.core.document.SourceSpan;

import java.util.*;

/**
 * Matches contiguous operator windows against a catalog of temporal idioms.
 *
 * <p>A window only matches when all of its operators come from the same document element.
 * Every rule yields at most one {@link TemporalPattern} holding all of its surviving instances;
 * instances weaker than the rule's minimum confidence are dropped.</p>
 */
public class TemporalPatternDetector {

    static final double QUALITY_SIMPLIFY_THRESHOLD = 0.6;
    static final double COVERAGE_THRESHOLD = 0.5;
    static final double LOW_DENSITY_THRESHOLD = 0.5;

    private final List<PatternRule> catalog;

    public TemporalPatternDetector() {
        this(PatternCatalog.standard());
    }

    public TemporalPatternDetector(List<PatternRule> catalog) {
        this.catalog = List.copyOf(catalog);
    }

    public PatternAnalysisResult detect(List<OperatorInstance> operators, int documentSize) {
        List<TemporalPattern> patterns = new ArrayList<>();
        for (PatternRule rule : catalog) {
            TemporalPattern p = match(operators, rule);
            if (p != null) patterns.add(p);
        }
        PatternStatistics statistics = statistics(patterns, documentSize);
        QualitySummary quality = quality(patterns);
        List<PatternRecommendation> recommendations = recommend(statistics, quality);
        List<AnalysisIssue> warnings = warnings(statistics, documentSize);
        return new PatternAnalysisResult(patterns, statistics, quality, recommendations, warnings);
    }

    private TemporalPattern match(List<OperatorInstance> operators, PatternRule rule) {
        int len = rule.sequence().size();
        List<PatternInstance> instances = new ArrayList<>();
        String description = null;
        for (int i = 0; i + len <= operators.size(); i++) {
            List<OperatorInstance> window = operators.subList(i, i + len);
            if (!matches(window, rule)) continue;

            StringJoiner formula = new StringJoiner(" ");
            TreeSet<String> vars = new TreeSet<>();
            for (OperatorInstance op : window) {
                formula.add(op.operator().toString());
                vars.addAll(op.operands());
            }
            List<String> variables = new ArrayList<>(vars);
            PatternStrength strength = strength(window);
            if (strength.overall() < rule.minConfidence()) continue;

            OperatorInstance first = window.get(0);
            instances.add(new PatternInstance(formula.toString(), variables, first.span(), strength,
                    first.context(), grade(strength, variables)));
            if (description == null) description = rule.describe(formula.toString(), variables);
        }
        if (instances.isEmpty()) return null;
        double confidence = instances.stream().mapToDouble(in -> in.strength().overall()).average().orElse(0.0);
        return new TemporalPattern(rule.kind(), description, instances, confidence);
    }

    private static boolean matches(List<OperatorInstance> window, PatternRule rule) {
        for (int k = 0; k < window.size(); k++) {
            OperatorInstance op = window.get(k);
            if (op.operator() != rule.sequence().get(k)) return false;
            if (!op.context().equals(window.get(0).context())) return false;
        }
        return true;
    }

    static PatternStrength strength(List<OperatorInstance> window) {
        double syntactic = window.size() <= 2 ? 0.9 : 0.7;
        boolean anyOperand = window.stream().anyMatch(op -> !op.operands().isEmpty());
        double semantic = anyOperand ? 0.8 : 0.5;
        int maxNesting = window.stream().mapToInt(OperatorInstance::nestingLevel).max().orElse(0);
        double coverage = maxNesting <= 2 ? 0.9 : 0.6;
        return PatternStrength.of(syntactic, semantic, coverage);
    }

    static PatternQuality grade(PatternStrength strength, List<String> variables) {
        double s = strength.overall();
        boolean meaningful = variables.stream().anyMatch(v -> v.length() > 1 && !isPunctuation(v));
        if (s >= 0.8 && meaningful) return PatternQuality.HIGH;
        if (s >= 0.7) return PatternQuality.MEDIUM;
        if (s >= 0.5) return PatternQuality.LOW;
        return PatternQuality.VERY_LOW;
    }

    private static boolean isPunctuation(String v) {
        for (int i = 0; i < v.length(); i++) {
            char c = v.charAt(i);
            if (c > 0x7f || Character.isLetterOrDigit(c) || Character.isWhitespace(c)) return false;
        }
        return true;
    }

    private static PatternStatistics statistics(List<TemporalPattern> patterns, int documentSize) {
        EnumMap<PatternKind, Integer> byKind = new EnumMap<>(PatternKind.class);
        int total = 0;
        int safety = 0;
        int liveness = 0;
        double strengthSum = 0.0;
        for (TemporalPattern p : patterns) {
            int n = p.instances().size();
            byKind.merge(p.kind(), n, Integer::sum);
            total += n;
            if (p.kind().isSafetyClass()) safety += n;
            if (p.kind().isLivenessClass()) liveness += n;
            for (PatternInstance in : p.instances()) strengthSum += in.strength().overall();
        }
        double avg = total == 0 ? 0.0 : strengthSum / total;
        double density = documentSize > 0 ? (double) total / documentSize * 100.0 : 0.0;
        CoverageMetrics coverage = total == 0 ? CoverageMetrics.NONE
                : new CoverageMetrics((double) safety / total, (double) liveness / total,
                (double) (safety + liveness) / total);
        return new PatternStatistics(total, byKind, avg, density, coverage);
    }

    private static QualitySummary quality(List<TemporalPattern> patterns) {
        int high = 0, medium = 0, low = 0;
        for (TemporalPattern p : patterns) {
            for (PatternInstance in : p.instances()) {
                switch (in.quality()) {
                    case HIGH -> high++;
                    case MEDIUM -> medium++;
                    case LOW, VERY_LOW -> low++;
                }
            }
        }
        int total = high + medium + low;
        double score = total == 0 ? 0.0 : (high + 0.6 * medium) / total;
        return new QualitySummary(high, medium, low, score);
    }

    private static List<PatternRecommendation> recommend(PatternStatistics stats, QualitySummary quality) {
        List<PatternRecommendation> out = new ArrayList<>();
        if (stats.totalPatterns() == 0) return out;
        if (stats.count(PatternKind.SAFETY) == 0) {
            out.add(new PatternRecommendation(RecommendationType.ADD_SAFETY,
                    "Consider adding safety patterns (□P) to specify invariant properties",
                    RecommendationPriority.HIGH));
        }
        if (stats.count(PatternKind.LIVENESS) == 0) {
            out.add(new PatternRecommendation(RecommendationType.ADD_LIVENESS,
                    "Consider adding liveness patterns (◊P) to specify progress properties",
                    RecommendationPriority.HIGH));
        }
        if (quality.score() < QUALITY_SIMPLIFY_THRESHOLD) {
            out.add(new PatternRecommendation(RecommendationType.SIMPLIFY,
                    "Consider simplifying temporal patterns and using more meaningful variable names",
                    RecommendationPriority.MEDIUM));
        }
        if (stats.coverage().overall() < COVERAGE_THRESHOLD) {
            out.add(new PatternRecommendation(RecommendationType.ENHANCE_COVERAGE,
                    "Consider adding more safety or liveness patterns to improve coverage",
                    RecommendationPriority.MEDIUM));
        }
        return out;
    }

    private static List<AnalysisIssue> warnings(PatternStatistics stats, int documentSize) {
        List<AnalysisIssue> out = new ArrayList<>();
        int safety = stats.count(PatternKind.SAFETY);
        int liveness = stats.count(PatternKind.LIVENESS);
        if (safety > 0 && liveness == 0) {
            out.add(AnalysisIssue.warning("Only safety patterns detected - consider adding liveness properties",
                    SourceSpan.UNKNOWN));
        }
        if (liveness > 0 && safety == 0) {
            out.add(AnalysisIssue.warning("Only liveness patterns detected - consider adding safety properties",
                    SourceSpan.UNKNOWN));
        }
        if (documentSize > 0 && stats.density() < LOW_DENSITY_THRESHOLD) {
            out.add(AnalysisIssue.warning("Low temporal pattern density - document may lack temporal specifications",
                    SourceSpan.UNKNOWN));
        }
        return out;
    }
}
