package com.raditha.pyopt.model;

/**
 * An addition or multiplication evaluated on every iteration of a loop.
 *
 * @param line             line of the operation
 * @param expressionDump   structural dump of the operation
 * @param expressionSource the operation printed back as source
 * @param loopLine         line of the nearest enclosing loop
 */
public record RepeatedComputation(int line, String expressionDump, String expressionSource, int loopLine)
        implements Finding {

    @Override
    public FindingKind kind() {
        return FindingKind.REPEATED_COMPUTATION;
    }

    @Override
    public String message() {
        return "Line " + line + ": Consider caching repeated computation '" + expressionDump + "'.";
    }
}
