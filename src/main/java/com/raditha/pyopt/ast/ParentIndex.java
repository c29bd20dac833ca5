package com.raditha.pyopt.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Per-pass side table of back-references.
 * <p>
 * Every node reachable from the root gets a stable index in pre-order (the root
 * is 0). A parallel array maps each index to the index of its parent, so upward
 * walks never need a field on the node itself. Lookups go by node identity:
 * two structurally equal nodes at different places in the tree have different
 * indices.
 * <p>
 * The table describes one tree shape only. Build a new one whenever the tree
 * changes.
 */
public final class ParentIndex {

    private static final int NO_PARENT = -1;

    private final List<Node> arena;
    private final int[] parents;
    private final Map<Node, Integer> indices;

    private ParentIndex(List<Node> arena, int[] parents, Map<Node, Integer> indices) {
        this.arena = arena;
        this.parents = parents;
        this.indices = indices;
    }

    /**
     * Build the index with a single iterative pre-order traversal.
     *
     * @throws IllegalArgumentException if a node instance appears twice
     */
    public static ParentIndex build(Node root) {
        List<Node> arena = new ArrayList<>();
        List<Integer> parentList = new ArrayList<>();
        Map<Node, Integer> indices = new IdentityHashMap<>();

        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> owners = new ArrayDeque<>();
        nodes.push(root);
        owners.push(NO_PARENT);

        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int parent = owners.pop();

            int index = arena.size();
            if (indices.putIfAbsent(node, index) != null) {
                throw new IllegalArgumentException("Node " + node.kind() + " at " + node.position()
                        + " is shared by more than one parent");
            }
            arena.add(node);
            parentList.add(parent);

            // push in reverse so children come off the stack in source order
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                nodes.push(children.get(i));
                owners.push(index);
            }
        }

        int[] parents = new int[parentList.size()];
        for (int i = 0; i < parents.length; i++) {
            parents[i] = parentList.get(i);
        }
        return new ParentIndex(List.copyOf(arena), parents, indices);
    }

    public int size() {
        return arena.size();
    }

    public Node node(int index) {
        return arena.get(index);
    }

    public boolean contains(Node node) {
        return indices.containsKey(node);
    }

    /**
     * Stable index of a node in this pass.
     *
     * @throws IllegalArgumentException if the node is not part of the indexed tree
     */
    public int indexOf(Node node) {
        Integer index = indices.get(node);
        if (index == null) {
            throw new IllegalArgumentException("Node " + node.kind() + " at " + node.position()
                    + " is not part of this tree");
        }
        return index;
    }

    public Optional<Node> parentOf(Node node) {
        int parent = parents[indexOf(node)];
        return parent == NO_PARENT ? Optional.empty() : Optional.of(arena.get(parent));
    }

    /**
     * Ancestors of a node, nearest first, ending with the root.
     */
    public List<Node> ancestors(Node node) {
        List<Node> result = new ArrayList<>();
        int current = parents[indexOf(node)];
        while (current != NO_PARENT) {
            result.add(arena.get(current));
            current = parents[current];
        }
        return result;
    }

    /**
     * Number of ancestors satisfying the predicate.
     */
    public int countAncestors(Node node, Predicate<Node> predicate) {
        int count = 0;
        int current = parents[indexOf(node)];
        while (current != NO_PARENT) {
            if (predicate.test(arena.get(current))) {
                count++;
            }
            current = parents[current];
        }
        return count;
    }

    /**
     * The closest ancestor satisfying the predicate. The walk stops there.
     */
    public Optional<Node> nearestAncestor(Node node, Predicate<Node> predicate) {
        int current = parents[indexOf(node)];
        while (current != NO_PARENT) {
            Node candidate = arena.get(current);
            if (predicate.test(candidate)) {
                return Optional.of(candidate);
            }
            current = parents[current];
        }
        return Optional.empty();
    }
}
