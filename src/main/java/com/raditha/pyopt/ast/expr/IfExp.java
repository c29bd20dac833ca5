package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * Conditional expression {@code body if test else orelse}.
 */
public record IfExp(Position position, Expr body, Expr test, Expr orelse) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.IF_EXP;
    }

    @Override
    public List<Node> children() {
        return List.of(body, test, orelse);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
