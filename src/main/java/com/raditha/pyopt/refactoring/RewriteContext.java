package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.ParentIndex;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.stmt.Alias;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.Import;
import com.raditha.pyopt.ast.stmt.ImportFrom;
import com.raditha.pyopt.util.AstUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scratch state of one rewrite pass. Created when the pass starts and thrown
 * away when it ends; nothing carries over to the next pass.
 */
public final class RewriteContext {

    private static final Logger logger = LoggerFactory.getLogger(RewriteContext.class);

    private final ParentIndex parents;
    private final Map<ImportRequirement, String> bindings;
    private final Set<ImportRequirement> provided;
    private final Set<Integer> transformed = new HashSet<>();
    private final Set<ImportRequirement> required = EnumSet.noneOf(ImportRequirement.class);
    private final List<AppliedRewrite> applied = new ArrayList<>();

    RewriteContext(ParentIndex parents, Map<ImportRequirement, String> bindings, Set<ImportRequirement> provided) {
        this.parents = parents;
        this.bindings = new EnumMap<>(ImportRequirement.class);
        this.bindings.putAll(bindings);
        this.provided = provided.isEmpty() ? EnumSet.noneOf(ImportRequirement.class) : EnumSet.copyOf(provided);
    }

    /**
     * Start a pass over a module: index it and settle the name each required
     * module is reached through.
     * <p>
     * A binding from the import prologue is reused when nothing else in the
     * file binds that name. Otherwise the injected import uses the default
     * name, unless the file binds that name to something else, in which case
     * it gets a fresh alias ({@code np_}, {@code np__}, ...) that the file
     * neither binds nor reads.
     */
    public static RewriteContext forModule(Module module) {
        Map<ImportRequirement, String> prologue = scanImportPrologue(module);
        List<AstUtility.Binding> all = AstUtility.allBindings(module);
        Set<String> referenced = AstUtility.namesIn(module);

        Map<ImportRequirement, String> bindings = new EnumMap<>(ImportRequirement.class);
        Set<ImportRequirement> provided = EnumSet.noneOf(ImportRequirement.class);
        for (ImportRequirement requirement : ImportRequirement.values()) {
            String existing = prologue.get(requirement);
            if (existing != null && bindsOnlyModule(all, existing, requirement)) {
                bindings.put(requirement, existing);
                provided.add(requirement);
                continue;
            }
            String candidate = requirement.defaultBinding();
            if (!bindsOnlyModule(all, candidate, requirement)) {
                do {
                    candidate = candidate + "_";
                } while (isBound(all, candidate) || referenced.contains(candidate));
                logger.debug("'{}' is bound to something else, importing {} as '{}'",
                        requirement.defaultBinding(), requirement.module(), candidate);
            }
            bindings.put(requirement, candidate);
        }
        return new RewriteContext(ParentIndex.build(module), bindings, provided);
    }

    /**
     * Whether every binding of the name anywhere in the file is an import of
     * the required module under that name. Trivially true for unbound names.
     */
    static boolean bindsOnlyModule(List<AstUtility.Binding> all, String name, ImportRequirement requirement) {
        return all.stream()
                .filter(b -> b.name().equals(name))
                .allMatch(b -> b.binder() instanceof Import imp && imp.names().stream()
                        .anyMatch(a -> a.boundName().equals(name) && importsModule(a, requirement)));
    }

    private static boolean importsModule(Alias alias, ImportRequirement requirement) {
        return alias.name().equals(requirement.module())
                || alias.asname() == null && alias.name().startsWith(requirement.module() + ".");
    }

    private static boolean isBound(List<AstUtility.Binding> all, String name) {
        return all.stream().anyMatch(b -> b.name().equals(name));
    }

    /**
     * Bindings from the leading run of docstring and import statements. Only
     * these are certain to be bound before any rewritten loop runs.
     */
    static Map<ImportRequirement, String> scanImportPrologue(Module module) {
        Map<ImportRequirement, String> bindings = new EnumMap<>(ImportRequirement.class);
        for (Stmt stmt : module.body()) {
            if (stmt instanceof Import imp) {
                for (ImportRequirement requirement : ImportRequirement.values()) {
                    imp.names().stream()
                            .filter(a -> a.name().equals(requirement.module()))
                            .map(Alias::boundName)
                            .findFirst()
                            .ifPresent(binding -> bindings.putIfAbsent(requirement, binding));
                }
            } else if (!(stmt instanceof ImportFrom) && !AstUtility.isDocstring(stmt)) {
                break;
            }
        }
        return bindings;
    }

    /**
     * Name under which the module is visible to rewritten code: an existing
     * binding if the file already imports it, otherwise the injected one.
     */
    public String bindingFor(ImportRequirement requirement) {
        return bindings.get(requirement);
    }

    void require(Collection<ImportRequirement> requirements) {
        required.addAll(requirements);
    }

    /**
     * Imports that rewritten code needs and the module does not provide, in
     * declaration order.
     */
    public List<ImportRequirement> importsToInject() {
        return required.stream()
                .filter(r -> !provided.contains(r))
                .toList();
    }

    void markTransformed(For loop) {
        transformed.add(parents.indexOf(loop));
    }

    public boolean isTransformed(For loop) {
        return parents.contains(loop) && transformed.contains(parents.indexOf(loop));
    }

    void record(AppliedRewrite rewrite) {
        applied.add(rewrite);
    }

    public List<AppliedRewrite> appliedRewrites() {
        return List.copyOf(applied);
    }

    public String scopeOf(For loop) {
        return AstUtility.scopeName(parents, loop);
    }
}
