package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.expr.Keyword;

import java.util.List;

/**
 * {@code class name(bases, keywords): body}
 */
public record ClassDef(Position position, String name, List<Expr> bases, List<Keyword> keywords, List<Expr> decorators, List<Stmt> body) implements Stmt {

    public ClassDef {
        bases = NodeLists.copy(bases);
        keywords = List.copyOf(keywords);
        decorators = NodeLists.copy(decorators);
        body = NodeLists.copy(body);
    }

    public ClassDef withBody(List<Stmt> newBody) {
        return new ClassDef(position, name, bases, keywords, decorators, newBody);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLASS_DEF;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(decorators, bases, keywords.stream().map(Keyword::value).toList(), body);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
