package com.raditha.pyopt.ast;

/**
 * Marker for expression nodes.
 */
public interface Expr extends Node {
}
