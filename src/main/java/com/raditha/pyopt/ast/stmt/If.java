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
 * {@code if}/{@code elif}/{@code else}. An {@code elif} is an {@code If} alone in the else block.
 */
public record If(Position position, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {

    public If {
        body = NodeLists.copy(body);
        orelse = NodeLists.copy(orelse);
    }

    public If withBlocks(List<Stmt> newBody, List<Stmt> newOrelse) {
        return new If(position, test, newBody, newOrelse);
    }

    /**
     * An else block holding nothing but another if prints as {@code elif}.
     */
    public boolean hasElif() {
        return orelse.size() == 1 && orelse.get(0) instanceof If;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
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
