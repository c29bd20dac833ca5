package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;

import java.util.List;
import java.util.Optional;

/**
 * {@code import a.b [as c], ...}
 */
public record Import(Position position, List<Alias> names) implements Stmt {

    public Import {
        names = List.copyOf(names);
    }

    /**
     * The alias importing the given module, if this statement imports it.
     */
    public Optional<Alias> find(String moduleName) {
        return names.stream().filter(a -> a.name().equals(moduleName)).findFirst();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
