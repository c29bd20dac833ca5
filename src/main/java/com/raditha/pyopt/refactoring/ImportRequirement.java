package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.stmt.Alias;
import com.raditha.pyopt.ast.stmt.Import;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Modules that rewritten code may depend on. Declaration order is the order
 * in which missing imports are injected.
 */
public enum ImportRequirement {
    /** {@code itertools.product} for flattened loops. */
    CROSS_PRODUCT("itertools", null),
    /** {@code numpy} arrays for vectorized loops. */
    VECTOR_ARRAY("numpy", "np");

    private final String module;
    private final @Nullable String alias;

    ImportRequirement(String module, @Nullable String alias) {
        this.module = module;
        this.alias = alias;
    }

    public String module() {
        return module;
    }

    /**
     * Name the injected import binds.
     */
    public String defaultBinding() {
        return alias != null ? alias : module;
    }

    /**
     * {@code import module [as binding]}, the alias omitted when the binding
     * is the module name itself.
     */
    public Import toImportStatement(String binding) {
        return new Import(Position.UNKNOWN, List.of(new Alias(module, binding.equals(module) ? null : binding)));
    }
}
