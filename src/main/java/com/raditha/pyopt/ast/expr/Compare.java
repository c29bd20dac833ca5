package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * Comparison chain {@code a < b <= c}.
 */
public record Compare(Position position, Expr left, List<CompareOperator> ops, List<Expr> comparators) implements Expr {

    public Compare {
        ops = List.copyOf(ops);
        comparators = NodeLists.copy(comparators);
        if (ops.size() != comparators.size()) {
            throw new IllegalArgumentException("each comparison operator needs one comparator");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPARE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(left, comparators);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
