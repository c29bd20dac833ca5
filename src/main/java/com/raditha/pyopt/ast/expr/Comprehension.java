package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * List, set and dict comprehensions and generator expressions. For dicts {@code element} is the key.
 */
public record Comprehension(Position position, ComprehensionKind comprehensionKind, Expr element, @Nullable Expr value, List<ComprehensionClause> generators) implements Expr {

    public Comprehension {
        generators = List.copyOf(generators);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPREHENSION;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(element, value, generators.stream().flatMap(g -> NodeLists.children(g.target(), g.iter(), g.conditions()).stream()).toList());
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
