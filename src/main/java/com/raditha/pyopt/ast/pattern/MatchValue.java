package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * A literal or dotted-name value compared with {@code ==}, such as {@code -1}, {@code "x"} or {@code Color.RED}.
 */
public record MatchValue(Position position, Expr value) implements Pattern {

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_VALUE;
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
