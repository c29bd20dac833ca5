package com.raditha.pyopt.ast;

import org.jspecify.annotations.Nullable;

/**
 * A single entry in the parameter list of a {@code def} or {@code lambda}.
 * Markers ({@code *} and {@code /}) have an empty name.
 */
public record Parameter(String name, ParameterKind kind, @Nullable Expr annotation, @Nullable Expr defaultValue) {

    public static Parameter simple(String name) {
        return new Parameter(name, ParameterKind.NORMAL, null, null);
    }
}
