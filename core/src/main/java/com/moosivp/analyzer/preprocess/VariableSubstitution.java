package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.diagnostic.DiagnosticCode;
import com.moosivp.analyzer.diagnostic.DiagnosticCollector;
import com.moosivp.analyzer.lexer.Primitives;
import com.moosivp.analyzer.lexer.SourceRange;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code $(NAME)}, {@code %(NAME)} and {@code ${NAME}} references against a
 * {@link SymbolTable}. {@code %(NAME)} expands to the upper-cased value. Unresolved references are
 * reported and left as written.
 */
public final class VariableSubstitution {

    private static final Pattern REFERENCE_PATTERN = Pattern.compile("([$%])\\(([^)]*)\\)|\\$\\{([^}]*)\\}");

    private final SymbolTable symbols;
    private final DiagnosticCollector diagnostics;
    private final boolean substituteInQuotes;

    public VariableSubstitution(SymbolTable symbols, DiagnosticCollector diagnostics, boolean substituteInQuotes) {
        this.symbols = symbols;
        this.diagnostics = diagnostics;
        this.substituteInQuotes = substituteInQuotes;
    }

    public List<Token> substitute(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            result.add(substitute(token));
        }
        return result;
    }

    public Token substitute(Token token) {
        if (token.is(TokenKind.VARIABLE) && token.complete()) {
            return expandReference(token);
        }
        if (token.is(TokenKind.QUOTED_STRING) && substituteInQuotes) {
            String expanded = expand(token.text(), token.range());
            return expanded.equals(token.text()) ? token : token.expandTo(TokenKind.QUOTED_STRING, expanded);
        }
        return token;
    }

    private Token expandReference(Token token) {
        Matcher matcher = REFERENCE_PATTERN.matcher(token.text());
        if (!matcher.matches()) {
            return token;
        }
        Optional<String> value = resolve(matcher, token.range());
        if (value.isEmpty()) {
            return token;
        }
        String expanded = value.get();
        return token.expandTo(Primitives.classify(expanded.trim()), expanded);
    }

    /**
     * Expands every reference inside {@code text}. {@code range} must be the single-line range the
     * text was read from; diagnostics point at the offending reference within it.
     */
    public String expand(String text, SourceRange range) {
        Matcher matcher = REFERENCE_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            SourceRange referenceRange = range.slice(matcher.start(), matcher.end() - matcher.start());
            String replacement = resolve(matcher, referenceRange).orElse(matcher.group());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private Optional<String> resolve(Matcher matcher, SourceRange range) {
        boolean upperCase = "%".equals(matcher.group(1));
        String name = (matcher.group(2) != null ? matcher.group(2) : matcher.group(3)).trim();
        Optional<String> value = symbols.lookup(name);
        if (value.isEmpty()) {
            diagnostics.report(DiagnosticCode.UNDEFINED_VARIABLE, range, "Undefined variable '" + name + "'");
            return Optional.empty();
        }
        return upperCase ? value.map(v -> v.toUpperCase(Locale.ROOT)) : value;
    }
}
