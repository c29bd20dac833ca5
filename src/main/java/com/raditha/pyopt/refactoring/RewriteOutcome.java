package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Module;

import java.util.List;

/**
 * Result of a rewrite pass: the new tree, the imports that were added to it,
 * and the rewrites applied, in document order.
 */
public record RewriteOutcome(Module tree, List<ImportRequirement> injectedImports, List<AppliedRewrite> appliedRewrites) {

    public RewriteOutcome {
        injectedImports = List.copyOf(injectedImports);
        appliedRewrites = List.copyOf(appliedRewrites);
    }

    public boolean isChanged() {
        return !appliedRewrites.isEmpty();
    }

    public long countRule(String rule) {
        return appliedRewrites.stream().filter(a -> a.rule().equals(rule)).count();
    }
}
