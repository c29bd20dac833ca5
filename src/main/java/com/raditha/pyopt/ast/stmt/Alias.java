package com.raditha.pyopt.ast.stmt;

import org.jspecify.annotations.Nullable;

/**
 * One imported name, {@code name [as asname]}.
 */
public record Alias(String name, @Nullable String asname) {

    /**
     * The name the import binds in the importing scope. For {@code import a.b}
     * without an alias that is the top-level package {@code a}.
     */
    public String boundName() {
        if (asname != null) {
            return asname;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
