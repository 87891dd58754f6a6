package com.moosivp.analyzer.diagnostic;

public enum DiagnosticCode {
    UNKNOWN_DIRECTIVE("UnknownDirective", Severity.ERROR),
    INVALID_IFNDEF_OPERATOR("InvalidIfndefOperator", Severity.ERROR),
    MIXED_CONDITIONAL_OPERATORS("MixedConditionalOperators", Severity.ERROR),
    MISPLACED_ELSE_IF_DEF("MisplacedElseIfDef", Severity.ERROR),
    ELSE_IF_NDEF_UNSUPPORTED("ElseIfNDefUnsupported", Severity.ERROR),
    UNMATCHED_ENDIF("UnmatchedEndif", Severity.ERROR),
    UNTERMINATED_CONDITIONAL("UnterminatedConditional", Severity.ERROR),
    UNTERMINATED_CONDITIONAL_ORIGIN("UnterminatedConditionalOrigin", Severity.ERROR),
    MALFORMED_DIRECTIVE("MalformedDirective", Severity.ERROR),
    VARIABLE_REDEFINED("VariableRedefined", Severity.WARNING),
    UNDEFINED_VARIABLE("UndefinedVariableWarning", Severity.WARNING),
    UNTERMINATED_QUOTE("UnterminatedQuote", Severity.ERROR),
    UNTERMINATED_VARIABLE("UnterminatedVariable", Severity.ERROR),
    INCLUDE_NOT_FOUND("IncludeNotFound", Severity.WARNING),
    INCLUDE_TAG_NOT_FOUND("IncludeTagNotFound", Severity.WARNING),
    INCLUDE_CYCLE_DETECTED("IncludeCycleDetected", Severity.ERROR),
    VECTOR_DIMENSION_MISMATCH("VectorDimensionMismatch", Severity.ERROR),
    MISSING_OPEN_BRACE("MissingOpenBrace", Severity.ERROR),
    MISSING_CLOSE_BRACE("MissingCloseBrace", Severity.ERROR),
    UNRECOGNIZED_CONSTRUCT("UnrecognizedConstruct", Severity.ERROR),
    MODE_DECLARED_BEFORE_PARENT("ModeDeclaredBeforeParent", Severity.ERROR),
    AMBIGUOUS_MODE_REFERENCE("AmbiguousModeReference", Severity.ERROR),
    ANALYSIS_FAILED("AnalysisFailed", Severity.ERROR);

    private final String code;
    private final Severity severity;

    DiagnosticCode(String code, Severity severity) {
        this.code = code;
        this.severity = severity;
    }

    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }

    /** Whether the code describes the nesting of conditional directives. */
    public boolean isConditionalStructure() {
        return switch (this) {
            case INVALID_IFNDEF_OPERATOR, MIXED_CONDITIONAL_OPERATORS, MISPLACED_ELSE_IF_DEF,
                    ELSE_IF_NDEF_UNSUPPORTED, UNMATCHED_ENDIF, UNTERMINATED_CONDITIONAL,
                    UNTERMINATED_CONDITIONAL_ORIGIN -> true;
            default -> false;
        };
    }
}
