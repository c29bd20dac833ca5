package com.raditha.pyopt.model;

/**
 * A single observation made by the pattern detector. Findings are immutable
 * and carry the 1-based source line they refer to.
 */
public interface Finding {

    int line();

    FindingKind kind();

    /**
     * Human readable suggestion, prefixed with the line number.
     */
    String message();
}
