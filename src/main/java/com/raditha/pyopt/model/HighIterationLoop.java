package com.raditha.pyopt.model;

import java.math.BigInteger;

/**
 * A {@code range(N)} loop whose literal bound exceeds the configured threshold.
 */
public record HighIterationLoop(int line, BigInteger bound) implements Finding {

    @Override
    public FindingKind kind() {
        return FindingKind.HIGH_ITERATION;
    }

    @Override
    public String message() {
        return "Line " + line + ": Consider optimizing loop with range(" + bound + ").";
    }
}
