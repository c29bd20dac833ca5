package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * Unary operation: {@code -x}, {@code +x}, {@code ~x}, {@code not x}.
 */
public record UnaryOp(Position position, UnaryOperator op, Expr operand) implements Expr {

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public List<Node> children() {
        return List.of(operand);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
