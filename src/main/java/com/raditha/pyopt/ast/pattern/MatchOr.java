package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * {@code p | q}: the first alternative that matches wins.
 */
public record MatchOr(Position position, List<Pattern> patterns) implements Pattern {

    public MatchOr {
        patterns = List.copyOf(patterns);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_OR;
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
