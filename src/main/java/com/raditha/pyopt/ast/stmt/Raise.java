package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code raise [exception [from cause]]}
 */
public record Raise(Position position, @Nullable Expr exception, @Nullable Expr cause) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.RAISE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(exception, cause);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
