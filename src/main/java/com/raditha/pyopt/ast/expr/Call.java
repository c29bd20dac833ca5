package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * Function call with positional ({@code *} starred) and keyword ({@code **} unpacking) arguments.
 */
public record Call(Position position, Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {

    public Call {
        args = NodeLists.copy(args);
        keywords = List.copyOf(keywords);
    }

    public Call(Position position, Expr func, List<Expr> args) {
        this(position, func, args, List.of());
    }

    /**
     * True when this calls a plain name, e.g. {@code range(...)}, rather than
     * an attribute or the result of another expression.
     */
    public boolean callsName(String name) {
        return func instanceof Name n && n.id().equals(name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(func, args, keywords.stream().map(Keyword::value).toList());
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
