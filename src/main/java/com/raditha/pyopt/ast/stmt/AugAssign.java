package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.expr.BinaryOperator;

import java.util.List;

/**
 * Augmented assignment such as {@code total += x}.
 */
public record AugAssign(Position position, Expr target, BinaryOperator op, Expr value) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.AUG_ASSIGN;
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
