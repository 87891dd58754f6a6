package com.moosivp.analyzer.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private static List<Token> tokens(String input) {
        return new Tokenizer(input).stream().collect(Collectors.toList());
    }

    private static List<Token> significant(String input) {
        return tokens(input).stream().filter(token -> !token.isTrivia()).collect(Collectors.toList());
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).collect(Collectors.toList());
    }

    @Test
    public void rawTextReproducesInput() {
        String input = "ServerHost = localhost // comment\r\n"
                + "#ifdef X 1\n"
                + "  ProcessConfig = uMS\n"
                + "{\n"
                + "  x = \"a // b\" $(Y) %(Z\n"
                + "}\n\r";
        String joined = tokens(input).stream().map(Token::raw).collect(Collectors.joining());
        assertEquals(input, joined);
    }

    @Test
    public void sequenceIsRestartable() {
        Tokenizer tokenizer = new Tokenizer("a = 1\nb = 2");
        List<Token> first = tokenizer.stream().collect(Collectors.toList());
        List<Token> second = tokenizer.stream().collect(Collectors.toList());
        assertEquals(first, second);
        assertFalse(first.isEmpty());
    }

    @Test
    public void directiveTokenCoversHashWhitespaceAndKeyword() {
        List<Token> tokens = significant("#  ifdef FOO");
        assertEquals(List.of(TokenKind.DIRECTIVE, TokenKind.IDENTIFIER), kinds(tokens));
        assertEquals("#  ifdef", tokens.get(0).raw());
    }

    @Test
    public void indentedHashStartsDirective() {
        List<Token> tokens = significant("   #include a.moos");
        assertEquals(TokenKind.DIRECTIVE, tokens.get(0).kind());
        assertEquals("a.moos", tokens.get(1).raw());
    }

    @Test
    public void hashAfterContentIsLiteral() {
        List<Token> tokens = significant("color = #ff0000");
        assertTrue(tokens.stream().noneMatch(token -> token.is(TokenKind.DIRECTIVE)));
        assertEquals("#ff0000", tokens.get(2).raw());
    }

    @Test
    public void doubleSlashIsNotACommentOnDirectiveLines() {
        List<Token> tokens = significant("#include path//file.moos");
        assertEquals(List.of(TokenKind.DIRECTIVE, TokenKind.IDENTIFIER), kinds(tokens));
        assertEquals("path//file.moos", tokens.get(1).raw());
    }

    @Test
    public void doubleSlashStartsCommentElsewhere() {
        List<Token> tokens = significant("x = 1 // note");
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.OPERATOR, TokenKind.INTEGER), kinds(tokens));
        Token comment = tokens("x = 1 // note").stream().filter(token -> token.is(TokenKind.COMMENT))
                .findFirst().orElseThrow();
        assertEquals("// note", comment.raw());
    }

    @Test
    public void quotedStringHidesComments() {
        List<Token> tokens = significant("name = \"a // b\"");
        assertEquals(TokenKind.QUOTED_STRING, tokens.get(2).kind());
        assertEquals("\"a // b\"", tokens.get(2).raw());
        assertTrue(tokens.get(2).complete());
    }

    @Test
    public void unterminatedQuoteIsIncomplete() {
        List<Token> tokens = significant("x = \"abc");
        Token quote = tokens.get(2);
        assertEquals(TokenKind.QUOTED_STRING, quote.kind());
        assertEquals("\"abc", quote.raw());
        assertFalse(quote.complete());
    }

    @Test
    public void variableReferences() {
        List<Token> tokens = significant("$(A) %(B) ${C} $(D");
        assertEquals(List.of(TokenKind.VARIABLE, TokenKind.VARIABLE, TokenKind.VARIABLE, TokenKind.VARIABLE),
                kinds(tokens));
        assertTrue(tokens.get(0).complete());
        assertTrue(tokens.get(1).complete());
        assertEquals("${C}", tokens.get(2).raw());
        assertTrue(tokens.get(2).complete());
        assertFalse(tokens.get(3).complete());
    }

    @Test
    public void variableFollowedByPathStaysSeparate() {
        List<Token> tokens = significant("$(DIR)/plugs/a.plug");
        assertEquals(2, tokens.size());
        assertEquals("$(DIR)", tokens.get(0).raw());
        assertEquals("/plugs/a.plug", tokens.get(1).raw());
    }

    @Test
    public void operators() {
        List<Token> tokens = significant("a==b != c<=d >= e && f || g ; @ ~");
        List<String> operators = tokens.stream()
                .filter(token -> token.is(TokenKind.OPERATOR))
                .map(Token::raw)
                .collect(Collectors.toList());
        assertEquals(List.of("==", "!=", "<=", ">=", "&&", "||", ";", "@", "~"), operators);
    }

    @Test
    public void wordsAreClassified() {
        List<Token> tokens = significant("0x1F 3.5 TRUE name nan 1.2.3 -7");
        assertEquals(List.of(TokenKind.INTEGER, TokenKind.FLOAT, TokenKind.BOOLEAN, TokenKind.IDENTIFIER,
                TokenKind.FLOAT, TokenKind.IDENTIFIER, TokenKind.INTEGER), kinds(tokens));
    }

    @Test
    public void colonsAndDotsBelongToWords() {
        List<Token> tokens = significant("points = 0,0:10,10 host.name");
        assertEquals("0:10", tokens.get(4).raw());
        assertEquals("host.name", tokens.get(7).raw());
    }

    @Test
    public void crlfIsOneNewlineAndPositionsFollowIt() {
        List<Token> tokens = tokens("a\r\nb");
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.NEWLINE, TokenKind.IDENTIFIER), kinds(tokens));
        assertEquals("\r\n", tokens.get(1).raw());
        SourcePosition start = tokens.get(2).range().start();
        assertEquals(1, start.line());
        assertEquals(0, start.column());
        assertEquals(3, start.offset());
    }

    @Test
    public void endOfInputPosition() {
        SourcePosition end = new Tokenizer("ab\ncde").endOfInput();
        assertEquals(1, end.line());
        assertEquals(3, end.column());
        assertEquals(6, end.offset());
    }
}
