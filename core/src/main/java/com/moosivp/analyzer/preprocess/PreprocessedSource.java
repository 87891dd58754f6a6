package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.lexer.SourceLine;
import com.moosivp.analyzer.lexer.SourcePosition;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.tree.IncludeDirective;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Output of the {@link DirectiveProcessor}.
 *
 * @param tokens        every token of the input as scanned
 * @param activeLines   non-directive lines in the active state, after substitution
 * @param includes      {@code #include} directives met on active lines
 * @param inactiveLines zero-based numbers of suppressed lines
 */
public record PreprocessedSource(
        List<Token> tokens,
        List<SourceLine> activeLines,
        List<IncludeDirective> includes,
        List<ConditionalRegion> regions,
        SortedSet<Integer> inactiveLines,
        SourcePosition endOfInput) {

    public PreprocessedSource {
        tokens = List.copyOf(tokens);
        activeLines = List.copyOf(activeLines);
        includes = List.copyOf(includes);
        regions = List.copyOf(regions);
        inactiveLines = Collections.unmodifiableSortedSet(new TreeSet<>(inactiveLines));
    }
}
