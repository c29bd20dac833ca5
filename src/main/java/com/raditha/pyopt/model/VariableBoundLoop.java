package com.raditha.pyopt.model;

/**
 * A {@code range(...)} loop whose single bound is not an integer literal, so
 * its iteration count is only known at run time.
 */
public record VariableBoundLoop(int line, String boundExpression) implements Finding {

    @Override
    public FindingKind kind() {
        return FindingKind.VARIABLE_BOUND;
    }

    @Override
    public String message() {
        return "Line " + line + ": Iteration count of range(" + boundExpression
                + ") depends on run-time values.";
    }
}
