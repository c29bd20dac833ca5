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
 * {@code assert test[, message]}
 */
public record Assert(Position position, Expr test, @Nullable Expr message) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.ASSERT;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(test, message);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
