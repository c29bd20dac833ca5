package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.stmt.For;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of applying one rule to one loop: the loop itself, or a splice of
 * statements that replaces it in the enclosing block.
 */
public interface RewriteResult {

    boolean isReplaced();

    static RewriteResult unchanged(For original) {
        return new Unchanged(original);
    }

    static RewriteResult replaced(List<Stmt> statements, ImportRequirement... requiredImports) {
        Set<ImportRequirement> imports = EnumSet.noneOf(ImportRequirement.class);
        imports.addAll(List.of(requiredImports));
        return new Replaced(statements, imports);
    }

    /**
     * The rule did not apply.
     */
    record Unchanged(For original) implements RewriteResult {

        @Override
        public boolean isReplaced() {
            return false;
        }
    }

    /**
     * Zero, one or many statements to graft in place of the loop, and the
     * imports they need.
     */
    record Replaced(List<Stmt> statements, Set<ImportRequirement> requiredImports) implements RewriteResult {

        public Replaced {
            statements = List.copyOf(statements);
            requiredImports = requiredImports.isEmpty()
                    ? Set.of()
                    : Collections.unmodifiableSet(EnumSet.copyOf(requiredImports));
        }

        @Override
        public boolean isReplaced() {
            return true;
        }
    }
}
