package com.moosivp.analyzer.tree;

import com.moosivp.analyzer.lexer.SourceRange;

import java.util.List;
import java.util.Optional;

/**
 * {@code Set MODE = VALUE { conditions } ELSE_VALUE}.
 *
 * @param parentValue value named by a {@code MODE = X} condition on the same mode variable, or
 *                    {@code null} for a root declaration
 * @param elseValue   value following the closing brace, or {@code null}
 */
public record ModeDeclaration(
        String modeVariable,
        String value,
        String parentValue,
        List<ConditionExpression> conditions,
        String elseValue,
        SourceRange headerRange,
        SourceRange parentRange,
        SourceRange range) implements Node {

    public ModeDeclaration {
        conditions = List.copyOf(conditions);
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parentValue);
    }

    public Optional<String> elseBranch() {
        return Optional.ofNullable(elseValue);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODE_DECLARATION;
    }
}
