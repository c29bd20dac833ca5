package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Annotated assignment {@code target: annotation [= value]}.
 */
public record AnnAssign(Position position, Expr target, Expr annotation, @Nullable Expr value) implements Stmt {

    @Override
    public NodeKind kind() {
        return NodeKind.ANN_ASSIGN;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(target, annotation, value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
