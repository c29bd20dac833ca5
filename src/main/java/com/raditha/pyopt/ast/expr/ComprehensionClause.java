package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.NodeLists;

import java.util.List;

/**
 * {@code [async] for target in iter [if condition]...} inside a comprehension.
 */
public record ComprehensionClause(Expr target, Expr iter, List<Expr> conditions, boolean isAsync) {

    public ComprehensionClause {
        conditions = NodeLists.copy(conditions);
    }
}
