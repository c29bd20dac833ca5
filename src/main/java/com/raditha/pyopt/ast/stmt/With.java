package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;

import java.util.List;

/**
 * {@code [async] with a as b, c: body}
 */
public record With(Position position, List<WithItem> items, List<Stmt> body, boolean isAsync) implements Stmt {

    public With {
        items = List.copyOf(items);
        body = NodeLists.copy(body);
    }

    public With withBody(List<Stmt> newBody) {
        return new With(position, items, newBody, isAsync);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WITH;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(items.stream().flatMap(i -> NodeLists.children(i.context(), i.optionalVars()).stream()).toList(), body);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
