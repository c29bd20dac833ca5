package com.raditha.pyopt.model;

/**
 * Categories of loop findings.
 */
public enum FindingKind {
    NESTED_LOOP,
    HIGH_ITERATION,
    REPEATED_COMPUTATION,
    VARIABLE_BOUND
}
