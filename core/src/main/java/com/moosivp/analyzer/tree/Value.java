package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.Primitives;
import com.moosivp.analyzer.lexer.SourceRange;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * An untyped source value together with the kind it was classified as. The typed interpretations
 * are computed on demand from {@code text}, which always holds the literal as written (after
 * variable substitution).
 */
public record Value(ValueKind kind, String text, SourceRange range) {

    public static Value of(String text, SourceRange range) {
        String trimmed = text.trim();
        return new Value(classify(trimmed), trimmed, range);
    }

    private static ValueKind classify(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return ValueKind.QUOTED;
        }
        if (VectorLiteral.looksLikeVector(text)) {
            return ValueKind.VECTOR;
        }
        return switch (Primitives.classify(text)) {
            case INTEGER -> ValueKind.INTEGER;
            case FLOAT -> ValueKind.FLOAT;
            case BOOLEAN -> ValueKind.BOOLEAN;
            default -> ValueKind.STRING;
        };
    }

    public OptionalLong asLong() {
        return Primitives.scanInteger(text);
    }

    public OptionalDouble asDouble() {
        OptionalLong integer = asLong();
        if (integer.isPresent()) {
            return OptionalDouble.of(integer.getAsLong());
        }
        return Primitives.scanFloat(text);
    }

    public Optional<Boolean> asBoolean() {
        return Primitives.scanBoolean(text);
    }

    public Optional<VectorLiteral> asVector() {
        return kind == ValueKind.VECTOR ? VectorLiteral.parse(text) : Optional.empty();
    }

    /** The text without surrounding quotes for quoted values, the text itself otherwise. */
    public String unquoted() {
        return kind == ValueKind.QUOTED ? text.substring(1, text.length() - 1) : text;
    }
}
