package com.raditha.pyopt.ast;

import java.util.List;

/**
 * One element of the syntax tree.
 * <p>
 * Nodes are immutable records. They hold no reference to their parent; upward
 * traversal goes through a {@link ParentIndex} built for the current pass.
 */
public interface Node {

    Position position();

    NodeKind kind();

    /**
     * Direct child nodes in source order. Absent optional children are skipped.
     */
    List<Node> children();

    <R, A> R accept(NodeVisitor<R, A> visitor, A arg);

    default int line() {
        return position().line();
    }
}
