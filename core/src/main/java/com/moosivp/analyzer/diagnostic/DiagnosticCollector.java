package com.moosivp.analyzer.diagnostic;

import com.moosivp.analyzer.lexer.SourceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the diagnostics of one analysis call. Not thread-safe; every call owns its own collector.
 */
public final class DiagnosticCollector {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticCollector.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public Diagnostic report(DiagnosticCode code, SourceRange range, String message) {
        Diagnostic diagnostic = Diagnostic.of(code, range, message);
        add(diagnostic);
        return diagnostic;
    }

    public void reportPaired(DiagnosticCode code, SourceRange range, String message,
            DiagnosticCode pairedCode, SourceRange pairedRange, String pairedMessage) {
        add(new Diagnostic(code.severity(), code, message, range, pairedRange));
        add(new Diagnostic(pairedCode.severity(), pairedCode, pairedMessage, pairedRange, range));
    }

    public void add(Diagnostic diagnostic) {
        logger.debug("Diagnostic {}", diagnostic);
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public long errorCount() {
        return diagnostics.stream().filter(Diagnostic::isError).count();
    }

    public int size() {
        return diagnostics.size();
    }
}
