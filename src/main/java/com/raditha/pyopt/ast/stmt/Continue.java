package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;

import java.util.List;

/**
 * {@code continue}
 */
public record Continue(Position position) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.CONTINUE;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
