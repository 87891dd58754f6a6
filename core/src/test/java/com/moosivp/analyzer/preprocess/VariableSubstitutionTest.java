package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.diagnostic.Diagnostic;
import com.moosivp.analyzer.diagnostic.DiagnosticCode;
import com.moosivp.analyzer.diagnostic.DiagnosticCollector;
import com.moosivp.analyzer.diagnostic.Severity;
import com.moosivp.analyzer.lexer.Token;
import com.moosivp.analyzer.lexer.TokenKind;
import com.moosivp.analyzer.lexer.Tokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class VariableSubstitutionTest {

    private DiagnosticCollector diagnostics;
    private SymbolTable symbols;

    @BeforeEach
    public void setUp() {
        diagnostics = new DiagnosticCollector();
        symbols = new SymbolTable(Map.of("HOME_DIR", "/home/vehicle"));
        symbols.define("NAME", "abc");
        symbols.define("COUNT", "42");
    }

    private List<Token> substitute(String input, boolean inQuotes) {
        VariableSubstitution substitution = new VariableSubstitution(symbols, diagnostics, inQuotes);
        return substitution.substitute(new Tokenizer(input).stream().collect(Collectors.toList()));
    }

    private static String text(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }

    @Test
    public void plainUpperCasedAndBraceForms() {
        assertEquals("x = abc ABC abc", text(substitute("x = $(NAME) %(NAME) ${NAME}", true)));
        assertTrue(diagnostics.diagnostics().isEmpty());
    }

    @Test
    public void rawTextIsKept() {
        Token token = substitute("$(NAME)", true).get(0);
        assertEquals("abc", token.text());
        assertEquals("$(NAME)", token.raw());
        assertTrue(token.isSubstituted());
    }

    @Test
    public void expandedTokenIsReclassified() {
        Token token = substitute("$(COUNT)", true).get(0);
        assertEquals(TokenKind.INTEGER, token.kind());
    }

    @Test
    public void environmentIsTheFallback() {
        assertEquals("/home/vehicle/plugs", text(substitute("$(HOME_DIR)/plugs", true)));
    }

    @Test
    public void localBindingShadowsEnvironment() {
        symbols.define("HOME_DIR", "/tmp");
        assertEquals("/tmp", text(substitute("$(HOME_DIR)", true)));
    }

    @Test
    public void undefinedReferenceWarnsAndStaysLiteral() {
        assertEquals("x = $(MISSING)", text(substitute("x = $(MISSING)", true)));
        List<Diagnostic> all = diagnostics.diagnostics();
        assertEquals(1, all.size());
        assertEquals(DiagnosticCode.UNDEFINED_VARIABLE, all.get(0).code());
        assertEquals(Severity.WARNING, all.get(0).severity());
        assertEquals(4, all.get(0).range().start().column());
    }

    @Test
    public void quotedStringsAreSubstitutedWhenEnabled() {
        assertEquals("\"path abc\"", text(substitute("\"path $(NAME)\"", true)));
    }

    @Test
    public void quotedStringsAreLeftAloneWhenDisabled() {
        assertEquals("\"path $(NAME)\"", text(substitute("\"path $(NAME)\"", false)));
        assertEquals("abc", text(substitute("$(NAME)", false)));
        assertTrue(diagnostics.diagnostics().isEmpty());
    }

    @Test
    public void undefinedReferenceInsideQuotesPointsAtTheReference() {
        substitute("v = \"a $(X)\"", true);
        Diagnostic diagnostic = diagnostics.diagnostics().get(0);
        assertEquals(DiagnosticCode.UNDEFINED_VARIABLE, diagnostic.code());
        assertEquals(7, diagnostic.range().start().column());
        assertEquals(11, diagnostic.range().end().column());
    }

    @Test
    public void commentsAreNeverSubstituted() {
        assertEquals("x = 1 // $(NAME)", text(substitute("x = 1 // $(NAME)", true)));
        assertTrue(diagnostics.diagnostics().isEmpty());
    }
}
