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
 * The loop node: {@code [async] for target in iter: body [else: orelse]}.
 */
public record For(Position position, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse, boolean isAsync) implements Stmt {

    public For {
        body = NodeLists.copy(body);
        orelse = NodeLists.copy(orelse);
    }

    public For(Position position, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) {
        this(position, target, iter, body, orelse, false);
    }

    public For(Position position, Expr target, Expr iter, List<Stmt> body) {
        this(position, target, iter, body, List.of());
    }

    public For withBlocks(List<Stmt> newBody, List<Stmt> newOrelse) {
        return new For(position, target, iter, newBody, newOrelse, isAsync);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(target, iter, body, orelse);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
