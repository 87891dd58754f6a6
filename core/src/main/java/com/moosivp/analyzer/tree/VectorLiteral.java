package com.moosivp.analyzer.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code [N]{...}} or {@code [NxM]{...}} literal. A plain {@code [N]} literal has one column.
 */
public record VectorLiteral(int rows, int columns, List<String> elements) {

    private static final Pattern VECTOR_PATTERN = Pattern.compile(
            "\\[\\s*(\\d+)\\s*(?:[xX]\\s*(\\d+)\\s*)?\\]\\s*\\{(.*)\\}");

    public VectorLiteral {
        elements = List.copyOf(elements);
    }

    public static boolean looksLikeVector(String text) {
        return VECTOR_PATTERN.matcher(text.trim()).matches();
    }

    public static Optional<VectorLiteral> parse(String text) {
        Matcher matcher = VECTOR_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            int rows = Integer.parseInt(matcher.group(1));
            int columns = matcher.group(2) == null ? 1 : Integer.parseInt(matcher.group(2));
            String body = matcher.group(3).trim();
            List<String> elements = new ArrayList<>();
            if (!body.isEmpty()) {
                for (String element : body.split(",", -1)) {
                    elements.add(element.trim());
                }
            }
            return Optional.of(new VectorLiteral(rows, columns, elements));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public long expectedSize() {
        return (long) rows * columns;
    }

    public boolean matchesDimensions() {
        return elements.size() == expectedSize();
    }
}
