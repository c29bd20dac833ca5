package com.raditha.pyopt.ast;

/**
 * Marker for statement nodes.
 */
public interface Stmt extends Node {
}
