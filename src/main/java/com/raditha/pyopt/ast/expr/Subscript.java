package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * {@code value[slice]}; multiple indices form a tuple slice.
 */
public record Subscript(Position position, Expr value, Expr slice) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.SUBSCRIPT;
    }

    @Override
    public List<Node> children() {
        return List.of(value, slice);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
