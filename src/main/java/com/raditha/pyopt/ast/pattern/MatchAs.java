package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A capture {@code name}, the wildcard {@code _} (no pattern, no name) or {@code pattern as name}.
 */
public record MatchAs(Position position, @Nullable Pattern pattern, @Nullable String name) implements Pattern {

    public boolean isWildcard() {
        return pattern == null && name == null;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_AS;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(pattern);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
