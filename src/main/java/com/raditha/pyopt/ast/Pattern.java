package com.raditha.pyopt.ast;

/**
 * Marker for the patterns of a {@code case} clause.
 */
public interface Pattern extends Node {
}
