package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import org.jspecify.annotations.Nullable;

/**
 * Keyword argument {@code arg=value}; a null {@code arg} is {@code **value}.
 */
public record Keyword(@Nullable String arg, Expr value) {
}
