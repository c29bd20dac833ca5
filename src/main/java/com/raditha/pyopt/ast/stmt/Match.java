package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;

import java.util.List;

/**
 * {@code match subject:} followed by one or more {@code case} clauses.
 */
public record Match(Position position, Expr subject, List<MatchCase> cases) implements Stmt {

    public Match {
        cases = List.copyOf(cases);
    }

    public Match withCases(List<MatchCase> newCases) {
        return new Match(position, subject, newCases);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(subject, cases);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
