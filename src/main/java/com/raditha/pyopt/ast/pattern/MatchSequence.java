package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * {@code [p, *rest]} or {@code (p, q)}; at most one element is a {@link MatchStar}.
 */
public record MatchSequence(Position position, List<Pattern> patterns) implements Pattern {

    public MatchSequence {
        patterns = List.copyOf(patterns);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_SEQUENCE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(patterns);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
