/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.document;

import ai.evacortex.chronocheck.core.exceptions.InvalidDocumentException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON interchange form of a {@link SpecDocument}.
 *
 * <pre>{@code
 * {
 *   "name": "mutex", "lines": 42,
 *   "variables":  [{"name": "busy", "type": "bool", "initial": "false"},
 *                  {"name": "phase", "values": ["idle", "run"], "initial": "idle"}],
 *   "rules":      [{"name": "r1", "text": "□(req → ◊ack)", "line": 3, "column": 1}],
 *   "functions":  [{"name": "acquire", "text": "...", "guard": "¬busy", "effects": {"busy": "true"}}],
 *   "meta":       [{"key": "invariant", "text": "□¬err"}],
 *   "evidence":   [{"field": "delta", "text": "◊done"}],
 *   "properties": [{"name": "p1", "text": "AG(busy → AF ¬busy)"}]
 * }
 * }</pre>
 *
 * Expressions are kept as raw text; analysis and verification parse them on demand.
 */
public class SpecDocumentReader {

    private final ObjectMapper mapper;

    public SpecDocumentReader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    record VariableJson(String name, String type, List<String> values, String initial) {}

    record ElementJson(String name, String key, String field, String text, String guard,
                       Map<String, String> effects, int line, int column) {}

    record DocumentJson(String name, int lines, List<VariableJson> variables, List<ElementJson> rules,
                        List<ElementJson> functions, List<ElementJson> meta, List<ElementJson> evidence,
                        List<ElementJson> properties) {}

    public SpecDocument read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new InvalidDocumentException("failed to read " + path, e);
        }
    }

    public SpecDocument read(InputStream in) {
        try {
            return validated(mapper.readValue(in, DocumentJson.class));
        } catch (IOException e) {
            throw new InvalidDocumentException("malformed JSON document", e);
        }
    }

    public SpecDocument readString(String content) {
        try {
            return validated(mapper.readValue(content, DocumentJson.class));
        } catch (IOException e) {
            throw new InvalidDocumentException("malformed JSON document", e);
        }
    }

    private SpecDocument validated(DocumentJson json) {
        if (json == null) throw new InvalidDocumentException("document is empty");
        try {
            return toDocument(json);
        } catch (IllegalArgumentException e) {
            throw new InvalidDocumentException(e.getMessage(), e);
        }
    }

    private SpecDocument toDocument(DocumentJson json) {
        SpecDocument.Builder b = SpecDocument.builder(json.name()).lineCount(Math.max(0, json.lines()));
        for (VariableJson v : nonNull(json.variables())) {
            b.variable(toVariable(v));
        }
        for (ElementJson e : nonNull(json.rules())) {
            b.rule(new RuleDecl(require(e.name(), "rule name"), expression(e)));
        }
        for (ElementJson e : nonNull(json.functions())) {
            Expression guard = e.guard() == null ? null : Expression.raw(e.guard(), span(e));
            Expression body = e.text() == null ? null : expression(e);
            b.function(new FunctionDecl(require(e.name(), "function name"), body, guard, e.effects()));
        }
        for (ElementJson e : nonNull(json.meta())) {
            b.meta(new MetaEntry(require(e.key(), "meta key"), expression(e)));
        }
        for (ElementJson e : nonNull(json.evidence())) {
            b.evidence(new EvidenceBlock(require(e.field(), "evidence field"), expression(e)));
        }
        for (ElementJson e : nonNull(json.properties())) {
            b.property(new TemporalProperty(require(e.name(), "property name"), expression(e)));
        }
        return b.build();
    }

    private static StateVariable toVariable(VariableJson v) {
        String name = require(v.name(), "variable name");
        if (v.values() == null || v.values().isEmpty() || "bool".equals(v.type()) || "boolean".equals(v.type())) {
            boolean initial = v.initial() != null && Boolean.parseBoolean(v.initial());
            return StateVariable.bool(name, initial);
        }
        String initial = v.initial() != null ? v.initial() : v.values().get(0);
        return StateVariable.enumeration(name, new ArrayList<>(v.values()), initial);
    }

    private static Expression expression(ElementJson e) {
        return Expression.raw(require(e.text(), "expression text"), span(e));
    }

    private static SourceSpan span(ElementJson e) {
        if (e.line() <= 0) return SourceSpan.UNKNOWN;
        int length = e.text() == null ? 0 : e.text().length();
        return new SourceSpan(e.line(), Math.max(1, e.column()), length);
    }

    private static String require(String value, String what) {
        if (value == null || value.isBlank()) throw new InvalidDocumentException("missing " + what);
        return value;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
