package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * {@code a and b and c} or {@code a or b}; consecutive operands of the same operator share one node.
 */
public record BoolOp(Position position, BoolOperator op, List<Expr> values) implements Expr {

    public BoolOp {
        values = NodeLists.copy(values);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOOL_OP;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(values);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
