package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Pattern;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One {@code case pattern [if guard]:} clause of a {@code match}.
 */
public record MatchCase(Position position, Pattern pattern, @Nullable Expr guard, List<Stmt> body) implements Node {

    public MatchCase {
        body = NodeLists.copy(body);
    }

    public MatchCase withBody(List<Stmt> newBody) {
        return new MatchCase(position, pattern, guard, newBody);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_CASE;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(pattern, guard, body);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
