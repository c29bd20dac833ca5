package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code *name} inside a sequence pattern; {@code *_} has no name.
 */
public record MatchStar(Position position, @Nullable String name) implements Pattern {

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_STAR;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
