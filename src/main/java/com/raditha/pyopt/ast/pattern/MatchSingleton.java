package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.expr.Constant;

import java.util.List;

/**
 * {@code None}, {@code True} or {@code False}, compared by identity.
 */
public record MatchSingleton(Position position, Constant value) implements Pattern {

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_SINGLETON;
    }

    @Override
    public List<Node> children() {
        return List.of(value);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
