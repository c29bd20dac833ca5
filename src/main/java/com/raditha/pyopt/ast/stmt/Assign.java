package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;

import java.util.List;

/**
 * Assignment, possibly chained: {@code a = b = value}.
 */
public record Assign(Position position, List<Expr> targets, Expr value) implements Stmt {

    public Assign {
        targets = NodeLists.copy(targets);
    }

    /**
     * Single-target assignment {@code target = value}.
     */
    public Assign(Position position, Expr target, Expr value) {
        this(position, List.of(target), value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(targets, value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
