package com.moosivp.analyzer.preprocess;

import com.moosivp.analyzer.lexer.SourceRange;

/**
 * One open {@code #ifdef} or {@code #ifndef} on the conditional stack.
 *
 * @param branchActive   whether the current branch's condition holds
 * @param branchTaken    whether this or an earlier branch of the frame was active
 * @param elseIfConsumed whether an {@code #elseifdef} already followed the opening directive
 * @param parentActive   whether the enclosing context was active when the frame was opened
 */
public record ConditionalFrame(
        DirectiveKind kind,
        boolean branchActive,
        boolean branchTaken,
        boolean elseIfConsumed,
        boolean parentActive,
        SourceRange openRange) {

    public static ConditionalFrame open(DirectiveKind kind, boolean condition, boolean parentActive,
            SourceRange openRange) {
        boolean active = parentActive && condition;
        return new ConditionalFrame(kind, active, active, false, parentActive, openRange);
    }

    public boolean isActive() {
        return parentActive && branchActive;
    }

    public boolean canElseIf() {
        return kind == DirectiveKind.IFDEF && !elseIfConsumed;
    }

    /** Whether an {@code #elseifdef} on this frame needs its condition evaluated at all. */
    public boolean elseIfReachable() {
        return parentActive && !branchTaken;
    }

    public ConditionalFrame elseIf(boolean condition) {
        boolean active = elseIfReachable() && condition;
        return new ConditionalFrame(kind, active, branchTaken || active, true, parentActive, openRange);
    }
}
