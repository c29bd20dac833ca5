package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * List display {@code [a, b]}.
 */
public record ListExpr(Position position, List<Expr> elements) implements Expr {

    public ListExpr {
        elements = NodeLists.copy(elements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(elements);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
