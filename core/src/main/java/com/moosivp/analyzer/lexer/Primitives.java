package com.moosivp.analyzer.lexer;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Scanning of the untyped literal forms that appear in mission and behavior values.
 */
public final class Primitives {

    private static final Pattern DECIMAL_FLOAT_PATTERN = Pattern.compile(
            "[+-]?(?:\\d+\\.?\\d*(?:[eE][+-]?\\d+)?|\\.\\d+(?:[eE][+-]?\\d+)?)");
    private static final Pattern SPECIAL_FLOAT_PATTERN = Pattern.compile(
            "[+-]?(?:nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

    private Primitives() {
    }

    public static OptionalLong scanInteger(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            if (text.length() > 2 && text.charAt(0) == '0') {
                switch (text.charAt(1)) {
                    case 'x', 'X' -> {
                        return OptionalLong.of(Long.parseLong(text.substring(2), 16));
                    }
                    case 'b', 'B' -> {
                        return OptionalLong.of(Long.parseLong(text.substring(2), 2));
                    }
                    case 'o', 'O' -> {
                        return OptionalLong.of(Long.parseLong(text.substring(2), 8));
                    }
                    default -> {
                    }
                }
            }
            return OptionalLong.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    public static OptionalDouble scanFloat(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (SPECIAL_FLOAT_PATTERN.matcher(text).matches()) {
            String lower = text.toLowerCase(Locale.ROOT);
            if (lower.endsWith("nan")) {
                return OptionalDouble.of(Double.NaN);
            }
            return OptionalDouble.of(lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        if (!DECIMAL_FLOAT_PATTERN.matcher(text).matches()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public static Optional<Boolean> scanBoolean(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(text)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * Classifies a single word. Integers win over floats, floats over booleans; anything else is an
     * identifier.
     */
    public static TokenKind classify(String word) {
        if (scanInteger(word).isPresent()) {
            return TokenKind.INTEGER;
        }
        if (scanFloat(word).isPresent()) {
            return TokenKind.FLOAT;
        }
        if (scanBoolean(word).isPresent()) {
            return TokenKind.BOOLEAN;
        }
        return TokenKind.IDENTIFIER;
    }
}
