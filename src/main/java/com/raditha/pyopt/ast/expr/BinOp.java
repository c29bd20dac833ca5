package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * Binary operation {@code left op right}.
 */
public record BinOp(Position position, Expr left, BinaryOperator op, Expr right) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.BIN_OP;
    }

    @Override
    public List<Node> children() {
        return List.of(left, right);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
