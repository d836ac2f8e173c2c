/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.document;

import java.util.ArrayList;
import java.util.List;

/**
 * In-process view of a parsed specification document.
 *
 * @param lineCount number of source lines; used as the document size for pattern density.
 *                  When zero, {@link #size()} falls back to the element count.
 */
public record SpecDocument(
        String name,
        List<StateVariable> variables,
        List<RuleDecl> rules,
        List<FunctionDecl> functions,
        List<MetaEntry> meta,
        List<EvidenceBlock> evidence,
        List<TemporalProperty> properties,
        int lineCount
) {

    public SpecDocument {
        name = name == null ? "<anonymous>" : name;
        variables = List.copyOf(variables);
        rules = List.copyOf(rules);
        functions = List.copyOf(functions);
        meta = List.copyOf(meta);
        evidence = List.copyOf(evidence);
        properties = List.copyOf(properties);
        if (lineCount < 0) throw new IllegalArgumentException("lineCount must be non-negative");
    }

    public int size() {
        if (lineCount > 0) return lineCount;
        return rules.size() + functions.size() + meta.size() + evidence.size() + properties.size();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<StateVariable> variables = new ArrayList<>();
        private final List<RuleDecl> rules = new ArrayList<>();
        private final List<FunctionDecl> functions = new ArrayList<>();
        private final List<MetaEntry> meta = new ArrayList<>();
        private final List<EvidenceBlock> evidence = new ArrayList<>();
        private final List<TemporalProperty> properties = new ArrayList<>();
        private int lineCount;

        private Builder(String name) {
            this.name = name;
        }

        public Builder variable(StateVariable v) { variables.add(v); return this; }
        public Builder rule(String ruleName, String text) { return rule(new RuleDecl(ruleName, Expression.raw(text, SourceSpan.UNKNOWN))); }
        public Builder rule(RuleDecl r) { rules.add(r); return this; }
        public Builder function(FunctionDecl f) { functions.add(f); return this; }
        public Builder meta(MetaEntry m) { meta.add(m); return this; }
        public Builder evidence(EvidenceBlock e) { evidence.add(e); return this; }
        public Builder property(String propertyName, String text) {
            return property(new TemporalProperty(propertyName, Expression.raw(text, SourceSpan.UNKNOWN)));
        }
        public Builder property(TemporalProperty p) { properties.add(p); return this; }
        public Builder lineCount(int lines) { this.lineCount = lines; return this; }

        public SpecDocument build() {
            return new SpecDocument(name, variables, rules, functions, meta, evidence, properties, lineCount);
        }
    }
}
