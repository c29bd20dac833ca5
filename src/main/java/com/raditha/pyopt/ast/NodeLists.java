package com.raditha.pyopt.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers shared by the node records for defensive copies and child lists.
 */
public final class NodeLists {

    private NodeLists() {
    }

    /**
     * Unmodifiable copy that, unlike {@link List#copyOf}, tolerates null
     * elements (dict unpacking entries have no key).
     */
    public static <T> List<T> copy(List<? extends T> list) {
        if (list == null || list.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * Flatten nodes and lists of nodes into one child list, skipping nulls.
     */
    public static List<Node> children(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Node node) {
                        result.add(node);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }
}
