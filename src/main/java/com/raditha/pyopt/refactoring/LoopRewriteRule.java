package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.stmt.For;

/**
 * A loop transformation. Implementations check their preconditions and
 * return {@link RewriteResult#unchanged} when any of them does not hold;
 * declining is never an error.
 */
public interface LoopRewriteRule {

    /**
     * Short identifier used in logs and reports, e.g. {@code flatten}.
     */
    String name();

    RewriteResult apply(For loop, RewriteContext context);
}
