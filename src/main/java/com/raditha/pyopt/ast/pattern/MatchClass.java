package com.raditha.pyopt.ast.pattern;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * {@code Cls(p, attr=q)}: positional patterns, then keyword attribute names with their patterns.
 */
public record MatchClass(Position position, Expr cls, List<Pattern> patterns, List<String> kwdAttrs, List<Pattern> kwdPatterns) implements Pattern {

    public MatchClass {
        patterns = List.copyOf(patterns);
        kwdAttrs = List.copyOf(kwdAttrs);
        kwdPatterns = List.copyOf(kwdPatterns);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_CLASS;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(cls, patterns, kwdPatterns);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
