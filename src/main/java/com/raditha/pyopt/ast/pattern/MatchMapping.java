package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code {key: pattern, **rest}}. Keys are literals or dotted names.
 */
public record MatchMapping(Position position, List<Expr> keys, List<Pattern> patterns, @Nullable String rest) implements Pattern {

    public MatchMapping {
        keys = List.copyOf(keys);
        patterns = List.copyOf(patterns);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_MAPPING;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(keys, patterns);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
