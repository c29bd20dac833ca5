package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeLists;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Dict display. A null key marks a {@code **mapping} unpacking entry.
 */
public record DictExpr(Position position, List<@Nullable Expr> keys, List<Expr> values) implements Expr {

    public DictExpr {
        keys = NodeLists.copy(keys);
        values = NodeLists.copy(values);
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("dict display needs one value per key");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DICT;
    }

    @Override
    public List<Node> children() {
        return NodeLists.children(keys, values);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
