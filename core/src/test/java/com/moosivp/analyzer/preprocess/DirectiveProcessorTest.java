package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.diagnostic.Diagnostic;
import com.moosivp.analyzer.diagnostic.DiagnosticCode;
import com.moosivp.analyzer.diagnostic.DiagnosticCollector;
import com.moosivp.analyzer.lexer.SourceLine;
import com.moosivp.analyzer.lexer.Tokenizer;
import com.moosivp.analyzer.model.FileType;
import com.moosivp.analyzer.tree.IncludeDirective;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DirectiveProcessorTest {

    private DiagnosticCollector diagnostics;
    private SymbolTable symbols;

    @BeforeEach
    public void setUp() {
        diagnostics = new DiagnosticCollector();
        symbols = SymbolTable.empty();
    }

    private PreprocessedSource process(String input) {
        return process(input, FileType.TEMPLATE, IncludeHandler.NONE);
    }

    private PreprocessedSource process(String input, FileType fileType, IncludeHandler handler) {
        VariableSubstitution substitution = new VariableSubstitution(symbols, diagnostics, true);
        return new DirectiveProcessor(fileType, symbols, substitution, diagnostics, handler)
                .process(new Tokenizer(input));
    }

    private static List<String> activeText(PreprocessedSource source) {
        return source.activeLines().stream()
                .filter(line -> !line.isBlank())
                .map(line -> line.text().trim())
                .collect(Collectors.toList());
    }

    private List<DiagnosticCode> codes() {
        return diagnostics.diagnostics().stream().map(Diagnostic::code).collect(Collectors.toList());
    }

    @Test
    public void definedConditionKeepsBranch() {
        PreprocessedSource source = process("#define FOO 1\n#ifdef FOO\nkept = 1\n#endif\nafter = 2");
        assertEquals(List.of("kept = 1", "after = 2"), activeText(source));
        assertTrue(codes().isEmpty());
        assertEquals(List.of(new ConditionalRegion(1, 3)), source.regions());
        assertTrue(source.inactiveLines().isEmpty());
    }

    @Test
    public void undefinedConditionSuppressesBranch() {
        PreprocessedSource source = process("#ifdef FOO\ndropped = 1\n#endif");
        assertTrue(activeText(source).isEmpty());
        assertEquals(List.of(1), new ArrayList<>(source.inactiveLines()));
        assertTrue(codes().isEmpty());
    }

    @Test
    public void clauseValueMustMatch() {
        String body = "#ifdef MODE sim\na = 1\n#elseifdef MODE real\nb = 2\n#endif";
        assertEquals(List.of("a = 1"), activeText(process("#define MODE sim\n" + body)));
        setUp();
        assertEquals(List.of("b = 2"), activeText(process("#define MODE real\n" + body)));
        setUp();
        assertTrue(activeText(process("#define MODE other\n" + body)).isEmpty());
    }

    @Test
    public void elseIfDefSkippedOnceEarlierBranchTaken() {
        PreprocessedSource source = process("#define A 1\n#define B 1\n#ifdef A\na = 1\n#elseifdef B\nb = 2\n#endif");
        assertEquals(List.of("a = 1"), activeText(source));
    }

    @Test
    public void conjunctionAndDisjunction() {
        String defines = "#define A 1\n#define B 1\n";
        assertEquals(List.of("x = 1"), activeText(process(defines + "#ifdef A && B\nx = 1\n#endif")));
        setUp();
        assertTrue(activeText(process(defines + "#ifdef A && C\nx = 1\n#endif")).isEmpty());
        setUp();
        assertEquals(List.of("x = 1"), activeText(process(defines + "#ifdef C || A\nx = 1\n#endif")));
    }

    @Test
    public void mixedOperatorsAreAnErrorAndFalse() {
        PreprocessedSource source = process("#define A 1\n#ifdef A && B || C\nx = 1\n#endif");
        assertTrue(activeText(source).isEmpty());
        assertEquals(List.of(DiagnosticCode.MIXED_CONDITIONAL_OPERATORS), codes());
    }

    @Test
    public void ifndef() {
        assertEquals(List.of("x = 1"), activeText(process("#ifndef FOO\nx = 1\n#endif")));
        assertTrue(codes().isEmpty());
        setUp();
        assertTrue(activeText(process("#define FOO\n#ifndef FOO\nx = 1\n#endif")).isEmpty());
    }

    @Test
    public void conditionNamesAreSubstituted() {
        PreprocessedSource source = process(String.join("\n",
                "#define WHICH SIM",
                "#define SIM 1",
                "#ifdef $(WHICH)",
                "a = 1",
                "#endif",
                "#ifndef $(WHICH)",
                "b = 2",
                "#endif",
                "#ifndef $(OTHER)",
                "c = 3",
                "#endif"));
        assertEquals(List.of("a = 1", "c = 3"), activeText(source));
        assertEquals(List.of(6), new ArrayList<>(source.inactiveLines()));
        assertEquals(List.of(DiagnosticCode.UNDEFINED_VARIABLE), codes());
    }

    @Test
    public void ifndefRejectsOperators() {
        process("#ifndef FOO || BAR\nx = 1\n#endif");
        assertEquals(List.of(DiagnosticCode.INVALID_IFNDEF_OPERATOR), codes());
    }

    @Test
    public void elseIfDefAfterIfndefIsUnsupported() {
        process("#ifndef A\n#elseifdef B\n#endif");
        assertEquals(List.of(DiagnosticCode.ELSE_IF_NDEF_UNSUPPORTED), codes());
    }

    @Test
    public void secondElseIfDefIsMisplaced() {
        process("#ifdef A\n#elseifdef B\n#elseifdef C\n#endif");
        assertEquals(List.of(DiagnosticCode.MISPLACED_ELSE_IF_DEF), codes());
    }

    @Test
    public void elseIfDefWithoutIfdefIsMisplaced() {
        process("#elseifdef A\nx = 1");
        assertEquals(List.of(DiagnosticCode.MISPLACED_ELSE_IF_DEF), codes());
    }

    @Test
    public void unmatchedEndif() {
        PreprocessedSource source = process("x = 1\n#endif");
        assertEquals(List.of(DiagnosticCode.UNMATCHED_ENDIF), codes());
        assertEquals(List.of("x = 1"), activeText(source));
    }

    @Test
    public void unterminatedConditionalsGiveExactlyTwoLinkedDiagnostics() {
        process("#ifdef A\n#ifdef B\nx = 1");
        List<Diagnostic> all = diagnostics.diagnostics();
        assertEquals(2, all.size());

        Diagnostic atEnd = all.get(0);
        Diagnostic origin = all.get(1);
        assertEquals(DiagnosticCode.UNTERMINATED_CONDITIONAL, atEnd.code());
        assertEquals(DiagnosticCode.UNTERMINATED_CONDITIONAL_ORIGIN, origin.code());
        assertEquals(0, origin.range().startLine());
        assertEquals(2, atEnd.range().startLine());
        assertEquals(origin.range(), atEnd.secondary().orElseThrow());
        assertEquals(atEnd.range(), origin.secondary().orElseThrow());
    }

    @Test
    public void unknownDirectiveIsReportedAndIgnored() {
        PreprocessedSource source = process("#else\nx = 1");
        assertEquals(List.of(DiagnosticCode.UNKNOWN_DIRECTIVE), codes());
        assertEquals(List.of("x = 1"), activeText(source));
    }

    @Test
    public void nestedConditionalInsideSuppressedRegionIsNotEvaluated() {
        PreprocessedSource source = process(
                "#define B 1\n#ifdef A\n#ifdef B\ny = 1\n#endif\nz = 1\n#endif\nw = 1");
        assertEquals(List.of("w = 1"), activeText(source));
        assertTrue(codes().isEmpty());
        assertEquals(2, source.regions().size());
        assertEquals(List.of(2, 3, 4, 5), new ArrayList<>(source.inactiveLines()));
    }

    @Test
    public void endifWithTrailingTextIsMalformedButCloses() {
        process("#ifdef A\n#endif // done");
        assertEquals(List.of(DiagnosticCode.MALFORMED_DIRECTIVE), codes());
    }

    @Test
    public void whitespaceBetweenHashAndKeyword() {
        PreprocessedSource source = process("#  define X 5\n#   ifdef X 5\nok = 1\n#endif");
        assertEquals(List.of("ok = 1"), activeText(source));
        assertEquals("5", symbols.lookup("X").orElseThrow());
    }

    @Test
    public void redefinitionWarns() {
        process("#define A 1\n#define A 2");
        assertEquals(List.of(DiagnosticCode.VARIABLE_REDEFINED), codes());
        assertEquals("2", symbols.lookup("A").orElseThrow());
    }

    @Test
    public void defineWithoutNameIsMalformed() {
        process("#define");
        assertEquals(List.of(DiagnosticCode.MALFORMED_DIRECTIVE), codes());
    }

    @Test
    public void missionDefineBindsOnlyOutsideBehaviorFiles() {
        process("define: SPEED = 1.5", FileType.MISSION, IncludeHandler.NONE);
        assertEquals("1.5", symbols.lookup("SPEED").orElseThrow());

        setUp();
        process("define: SPEED = 1.5", FileType.BEHAVIOR, IncludeHandler.NONE);
        assertTrue(symbols.lookup("SPEED").isEmpty());
    }

    @Test
    public void substitutionAppliesToActiveLines() {
        PreprocessedSource source = process("#define HOST localhost\nServerHost = $(HOST)");
        assertEquals(List.of("ServerHost = localhost"), activeText(source));
    }

    @Test
    public void unterminatedQuoteReportedOnlyOnActiveLines() {
        process("x = \"abc");
        assertEquals(List.of(DiagnosticCode.UNTERMINATED_QUOTE), codes());

        setUp();
        process("#ifdef NOPE\nx = \"abc\n#endif");
        assertTrue(codes().isEmpty());
    }

    @Test
    public void unterminatedVariable() {
        process("x = $(ABC");
        assertEquals(List.of(DiagnosticCode.UNTERMINATED_VARIABLE), codes());
    }

    @Test
    public void directiveLinesOfSuppressedFramesAreInactive() {
        PreprocessedSource source = process("#ifdef A\n#ifdef B\n#endif\n#endif");
        assertEquals(List.of(1, 2), new ArrayList<>(source.inactiveLines()));
    }

    @Test
    public void includeHandsPathAndTagToHandler() {
        List<String> calls = new ArrayList<>();
        IncludeHandler handler = (path, tag, range) -> {
            calls.add(path + "|" + tag);
            return true;
        };
        PreprocessedSource source = process("#include common.plug <TAG>", FileType.TEMPLATE, handler);

        assertEquals(List.of("common.plug|TAG"), calls);
        IncludeDirective include = source.includes().get(0);
        assertEquals("common.plug", include.path());
        assertEquals("TAG", include.tag());
        assertTrue(include.resolved());
        assertEquals(9, include.pathRange().start().column());
        assertEquals(20, include.pathRange().end().column());
        assertTrue(codes().isEmpty());
    }

    @Test
    public void includePathIsSubstitutedAndUnquoted() {
        symbols = new SymbolTable(Map.of("DIR", "lib"));
        List<String> paths = new ArrayList<>();
        IncludeHandler handler = (path, tag, range) -> paths.add(path);
        process("#include \"$(DIR)/a.moos\"\n#include $(DIR)/b.moos", FileType.TEMPLATE, handler);
        assertEquals(List.of("lib/a.moos", "lib/b.moos"), paths);
    }

    @Test
    public void includeInsideSuppressedRegionIsSkipped() {
        List<String> paths = new ArrayList<>();
        PreprocessedSource source = process("#ifdef NOPE\n#include a.moos\n#endif", FileType.TEMPLATE,
                (path, tag, range) -> paths.add(path));
        assertTrue(paths.isEmpty());
        assertTrue(source.includes().isEmpty());
    }

    @Test
    public void malformedIncludes() {
        process("#include\n#include a.moos extra");
        assertEquals(List.of(DiagnosticCode.MALFORMED_DIRECTIVE, DiagnosticCode.MALFORMED_DIRECTIVE), codes());
    }

    @Test
    public void linesKeepTheirNumbers() {
        PreprocessedSource source = process("a = 1\n#define X 1\nb = 2");
        List<Integer> numbers = source.activeLines().stream().map(SourceLine::line).collect(Collectors.toList());
        assertEquals(List.of(0, 2), numbers);
    }
}
