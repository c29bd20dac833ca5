package com.raditha.pyopt.refactoring;

/**
 * Record of a rule that fired.
 *
 * @param rule  rule name
 * @param line  line of the replaced loop
 * @param scope enclosing function or class, or {@code <module>}
 */
public record AppliedRewrite(String rule, int line, String scope) {

    public String describe() {
        return String.format("Line %d: applied %s in %s", line, rule, scope);
    }
}
