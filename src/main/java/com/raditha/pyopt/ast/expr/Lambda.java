package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Parameter;
import com.raditha.pyopt.ast.Position;

import java.util.List;

/**
 * {@code lambda parameters: body}
 */
public record Lambda(Position position, List<Parameter> parameters, Expr body) implements Expr {

    public Lambda {
        parameters = List.copyOf(parameters);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAMBDA;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(parameters.stream().map(Parameter::defaultValue).toList(), body);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
