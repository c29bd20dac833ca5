package com.raditha.pyopt.ast;

import java.util.List;

/**
 * Root of a syntax tree: the statements of one source file.
 */
public record Module(Position position, List<Stmt> body) implements Node {

    public Module {
        body = NodeLists.copy(body);
    }

    public Module(List<Stmt> body) {
        this(new Position(1, 0), body);
    }

    public Module withBody(List<Stmt> newBody) {
        return new Module(position, newBody);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODULE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(body);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
