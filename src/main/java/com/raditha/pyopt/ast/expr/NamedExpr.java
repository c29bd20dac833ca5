package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * Assignment expression {@code target := value}. The target binds in the
 * enclosing function or module, even inside a comprehension.
 */
public record NamedExpr(Position position, Name target, Expr value) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.NAMED_EXPR;
    }

    @Override
    public List<Node> children() {
        return List.of(target, value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
