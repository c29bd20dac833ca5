package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;

import java.util.List;

/**
 * {@code global} or {@code nonlocal} declaration.
 */
public record Global(Position position, List<String> names, boolean nonlocal) implements Stmt {

    public Global {
        names = List.copyOf(names);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GLOBAL;
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
