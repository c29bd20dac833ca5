package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Parameter;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code [async] def name(parameters) -> returns: body}
 */
public record FunctionDef(Position position, String name, List<Parameter> parameters, @Nullable Expr returns, List<Expr> decorators, List<Stmt> body, boolean isAsync) implements Stmt {

    public FunctionDef {
        parameters = List.copyOf(parameters);
        decorators = NodeLists.copy(decorators);
        body = NodeLists.copy(body);
    }

    public FunctionDef withBody(List<Stmt> newBody) {
        return new FunctionDef(position, name, parameters, returns, decorators, newBody, isAsync);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(decorators, parameters.stream().flatMap(p -> NodeLists.children(p.annotation(), p.defaultValue()).stream()).toList(), returns, body);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
