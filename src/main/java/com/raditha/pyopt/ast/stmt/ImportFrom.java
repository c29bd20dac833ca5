package com.raditha.pyopt.ast.stmt;

import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code from [.]module import names}. {@code level} counts leading dots.
 */
public record ImportFrom(Position position, @Nullable String module, List<Alias> names, int level) implements Stmt {

    public ImportFrom {
        names = List.copyOf(names);
    }

    public boolean isFutureImport() {
        return level == 0 && "__future__".equals(module);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_FROM;
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
