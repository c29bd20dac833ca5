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
 * {@code while test: body [else: orelse]}
 */
public record While(Position position, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {

    public While {
        body = NodeLists.copy(body);
        orelse = NodeLists.copy(orelse);
    }

    public While withBlocks(List<Stmt> newBody, List<Stmt> newOrelse) {
        return new While(position, test, newBody, newOrelse);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WHILE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(test, body, orelse);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
