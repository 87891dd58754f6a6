package com.moosivp.analyzer.diagnostic;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.Optional;

/**
 * @param secondaryRange related location, or {@code null}. Paired diagnostics such as an unterminated
 *                       conditional point at each other through it.
 */
public record Diagnostic(
        Severity severity,
        DiagnosticCode code,
        String message,
        SourceRange range,
        SourceRange secondaryRange) {

    public static Diagnostic of(DiagnosticCode code, SourceRange range, String message) {
        return new Diagnostic(code.severity(), code, message, range, null);
    }

    public Optional<SourceRange> secondary() {
        return Optional.ofNullable(secondaryRange);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code.code() + " at " + range + ": " + message;
    }
}
