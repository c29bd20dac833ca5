package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import org.jspecify.annotations.Nullable;

/**
 * {@code context [as optionalVars]} inside a {@code with} header.
 */
public record WithItem(Expr context, @Nullable Expr optionalVars) {
}
