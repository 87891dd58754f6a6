package com.moosivp.analyzer.lexer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The tokens of one physical line, without its line terminator.
 */
public record SourceLine(int line, List<Token> tokens) {

    public SourceLine {
        tokens = List.copyOf(tokens);
    }

    /** Tokens other than whitespace and comments. */
    public List<Token> significant() {
        return tokens.stream().filter(token -> !token.isTrivia()).collect(Collectors.toList());
    }

    public boolean isBlank() {
        return tokens.stream().allMatch(Token::isTrivia);
    }

    public String text() {
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }

    public String raw() {
        return tokens.stream().map(Token::raw).collect(Collectors.joining());
    }

    public SourceRange range() {
        if (tokens.isEmpty()) {
            return null;
        }
        return tokens.get(0).range().to(tokens.get(tokens.size() - 1).range());
    }

    /** Range covering the significant tokens only. */
    public SourceRange contentRange() {
        List<Token> content = significant();
        if (content.isEmpty()) {
            return range();
        }
        return content.get(0).range().to(content.get(content.size() - 1).range());
    }
}
