package com.raditha.pyopt.ast;

/**
 * Kinds of entries in a parameter list.
 */
public enum ParameterKind {
    /** {@code name}, {@code name: ann} or {@code name=default}. */
    NORMAL,
    /** {@code *args} */
    VAR_POSITIONAL,
    /** {@code **kwargs} */
    VAR_KEYWORD,
    /** bare {@code *} separating keyword-only parameters */
    KEYWORD_ONLY_MARKER,
    /** bare {@code /} ending positional-only parameters */
    POSITIONAL_ONLY_MARKER
}
