package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * {@code value.attr}
 */
public record Attribute(Position position, Expr value, String attr) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public List<Node> children() {
        return List.of(value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
