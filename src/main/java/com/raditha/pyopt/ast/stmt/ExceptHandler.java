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
 * One {@code except [type [as name]]:} clause of a {@code try}.
 */
public record ExceptHandler(Position position, @Nullable Expr type, @Nullable String name, List<Stmt> body) implements Node {

    public ExceptHandler {
        body = NodeLists.copy(body);
    }

    public ExceptHandler withBody(List<Stmt> newBody) {
        return new ExceptHandler(position, type, name, newBody);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCEPT_HANDLER;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(type, body);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
