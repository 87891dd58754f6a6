package com.moosivp.analyzer.parser;

import com.moosivp.analyzer.lexer.SourceRange;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.lexer.TokenKind;

import java.util.List;
import java.util.stream.Collectors;

final class TokenText {

    private TokenText() {
    }

    /** Text of the tokens with whitespace kept as written and comments dropped, trimmed. */
    static String of(List<Token> tokens) {
        return tokens.stream()
                .filter(token -> !token.is(TokenKind.COMMENT) && !token.is(TokenKind.NEWLINE))
                .map(Token::text)
                .collect(Collectors.joining())
                .trim();
    }

    /** Text of significant tokens, with a single blank wherever the source had whitespace. */
    static String spaced(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && previous.range().end().offset() < token.range().start().offset()) {
                sb.append(' ');
            }
            sb.append(token.text());
            previous = token;
        }
        return sb.toString();
    }

    static SourceRange range(List<Token> tokens) {
        return tokens.get(0).range().to(tokens.get(tokens.size() - 1).range());
    }

    static int indexOfOperator(List<Token> tokens, String operator) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isOperator(operator)) {
                return i;
            }
        }
        return -1;
    }
}
