package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;

import java.util.List;

/**
 * {@code try}/{@code except}/{@code else}/{@code finally}. With {@code isStar}
 * every handler is an {@code except*} clause over an exception group.
 */
public record Try(Position position, List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse, List<Stmt> finalbody, boolean isStar) implements Stmt {

    public Try {
        body = NodeLists.copy(body);
        handlers = List.copyOf(handlers);
        orelse = NodeLists.copy(orelse);
        finalbody = NodeLists.copy(finalbody);
    }

    public Try(Position position, List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse, List<Stmt> finalbody) {
        this(position, body, handlers, orelse, finalbody, false);
    }

    public Try withBlocks(List<Stmt> newBody, List<ExceptHandler> newHandlers, List<Stmt> newOrelse, List<Stmt> newFinalbody) {
        return new Try(position, newBody, newHandlers, newOrelse, newFinalbody, isStar);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRY;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(body, handlers, orelse, finalbody);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
