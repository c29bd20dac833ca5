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
 * {@code del a, b}
 */
public record Delete(Position position, List<Expr> targets) implements Stmt {

    public Delete {
        targets = NodeLists.copy(targets);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DELETE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(targets);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
