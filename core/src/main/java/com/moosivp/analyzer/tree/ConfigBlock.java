package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shared shape of {@link ProcessConfigBlock} and {@link BehaviorBlock}. Entries keep declaration order
 * and duplicates.
 */
public interface ConfigBlock extends Node {

    String name();

    List<BlockEntry> entries();

    SourceRange headerRange();

    /** Range of the closing brace, or {@code null} when it is missing. */
    SourceRange closeRange();

    default List<Parameter> parameters() {
        return entries().stream()
                .filter(entry -> !entry.isMarker())
                .map(Parameter.class::cast)
                .collect(Collectors.toList());
    }

    default List<Value> values(String key) {
        return parameters().stream()
                .filter(parameter -> parameter.key().equalsIgnoreCase(key))
                .map(Parameter::value)
                .collect(Collectors.toList());
    }

    default Optional<Value> firstValue(String key) {
        return values(key).stream().findFirst();
    }
}
