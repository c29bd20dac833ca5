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
 * {@code lower:upper:step} inside a subscript.
 */
public record Slice(Position position, @Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.SLICE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(lower, upper, step);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
