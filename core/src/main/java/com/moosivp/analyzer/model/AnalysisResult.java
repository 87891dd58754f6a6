package com.moosivp.analyzer.model;

import com.moosivp.analyzer.diagnostic.Diagnostic;
import com.moosivp.analyzer.diagnostic.Severity;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.mode.ModeTree;
import com.moosivp.analyzer.preprocess.ConditionalRegion;
import com.moosivp.analyzer.tree.Document;
import com.moosivp.analyzer.tree.IncludeDirective;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Everything one analysis call produced. Immutable; editor views are derived from it.
 *
 * @param tokens        the full token stream of the source as written
 * @param symbols       local definitions at the end of the file, includes merged
 * @param inactiveLines zero-based lines suppressed by conditionals
 */
public record AnalysisResult(
        String source,
        FileType fileType,
        List<Token> tokens,
        Document document,
        ModeTree modeTree,
        Map<String, String> symbols,
        List<Diagnostic> diagnostics,
        SortedSet<Integer> inactiveLines,
        List<ConditionalRegion> conditionalRegions,
        long analysisTimeMs) {

    public AnalysisResult {
        tokens = List.copyOf(tokens);
        symbols = Map.copyOf(symbols);
        diagnostics = List.copyOf(diagnostics);
        inactiveLines = Collections.unmodifiableSortedSet(new TreeSet<>(inactiveLines));
        conditionalRegions = List.copyOf(conditionalRegions);
    }

    public static AnalysisResult failed(String source, FileType fileType, Diagnostic diagnostic,
            long analysisTimeMs) {
        return new AnalysisResult(source, fileType, List.of(), new Document(List.of()), ModeTree.empty(), Map.of(),
                List.of(diagnostic), new TreeSet<>(), List.of(), analysisTimeMs);
    }

    /** Includes whose target was found; each becomes a document link. */
    public List<IncludeDirective> resolvedIncludes() {
        return document.nodesOf(IncludeDirective.class).stream()
                .filter(IncludeDirective::resolved)
                .collect(Collectors.toList());
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).collect(Collectors.toList());
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).collect(Collectors.toList());
    }

    public boolean isInactive(int line) {
        return inactiveLines.contains(line);
    }
}
