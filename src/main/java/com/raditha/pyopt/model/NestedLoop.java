package com.raditha.pyopt.model;

/**
 * A loop enclosed by {@code depth} other loops.
 *
 * @param line  line of the inner loop
 * @param depth number of enclosing loops, at least 1
 */
public record NestedLoop(int line, int depth) implements Finding {

    public NestedLoop {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
    }

    @Override
    public FindingKind kind() {
        return FindingKind.NESTED_LOOP;
    }

    @Override
    public String message() {
        return String.format("Line %d: Loop nested %d level%s deep. Consider flattening it.",
                line, depth, depth == 1 ? "" : "s");
    }
}
