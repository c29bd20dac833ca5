package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code yield [value]} or, when delegating, {@code yield from value}.
 */
public record Yield(Position position, @Nullable Expr value, boolean delegating) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.YIELD;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
