package com.moosivp.analyzer.preprocess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Variable bindings of one analysis call: a local layer written by {@code #define} and
 * {@code define:} over a read-only environment layer.
 */
public final class SymbolTable {

    private final Map<String, String> local;
    private final Map<String, String> environment;

    public SymbolTable(Map<String, String> environment) {
        this(new LinkedHashMap<>(), Map.copyOf(Objects.requireNonNull(environment, "environment")));
    }

    private SymbolTable(Map<String, String> local, Map<String, String> environment) {
        this.local = local;
        this.environment = environment;
    }

    public static SymbolTable empty() {
        return new SymbolTable(Map.of());
    }

    /**
     * Binds {@code name} in the local layer.
     *
     * @return the previous local binding, if there was one
     */
    public Optional<String> define(String name, String value) {
        return Optional.ofNullable(local.put(name, value));
    }

    public Optional<String> lookup(String name) {
        String value = local.get(name);
        if (value == null) {
            value = environment.get(name);
        }
        return Optional.ofNullable(value);
    }

    public boolean isDefined(String name) {
        return local.containsKey(name) || environment.containsKey(name);
    }

    /** A table with the same environment and an independent copy of the local layer. */
    public SymbolTable copy() {
        return new SymbolTable(new LinkedHashMap<>(local), environment);
    }

    /** Adopts every local binding of {@code other}, replacing existing ones. */
    public void mergeFrom(SymbolTable other) {
        local.putAll(other.local);
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(local));
    }

    public SortedSet<String> localNames() {
        return new TreeSet<>(local.keySet());
    }
}
