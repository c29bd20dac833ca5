package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.ast.stmt.ImportFrom;
import com.raditha.pyopt.parser.PythonParser;
import com.raditha.pyopt.parser.SourceParseException;
import com.raditha.pyopt.util.AstUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies loop rewrite rules to a syntax tree.
 * <p>
 * Loops are visited top-down. For each loop the rules are tried in priority
 * order and the first one that applies wins; its replacement is spliced into
 * the enclosing block and is not visited again. If no rule applies the engine
 * descends into the loop's blocks. The input tree is never modified.
 * <p>
 * Imports needed by the replacements are added once, at the top of the
 * module after any docstring and {@code from __future__} imports, under the
 * names the {@link RewriteContext} settled on.
 */
public class RewriteEngine {

    private static final Logger logger = LoggerFactory.getLogger(RewriteEngine.class);

    private final List<LoopRewriteRule> rules;

    /**
     * Create an engine with every rule enabled: flattening, then vectorization.
     */
    public RewriteEngine() {
        this(List.of(new LoopFlatteningRule(), new VectorizationRule()));
    }

    public RewriteEngine(List<LoopRewriteRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Create an engine with a subset of the built-in rules, keeping their order.
     */
    public static RewriteEngine withRules(boolean flatten, boolean vectorize) {
        List<LoopRewriteRule> rules = new ArrayList<>();
        if (flatten) {
            rules.add(new LoopFlatteningRule());
        }
        if (vectorize) {
            rules.add(new VectorizationRule());
        }
        return new RewriteEngine(rules);
    }

    public List<LoopRewriteRule> getRules() {
        return rules;
    }

    /**
     * Parse and rewrite source text.
     *
     * @throws SourceParseException if the text is not valid Python
     */
    public RewriteOutcome rewrite(String sourceText) throws SourceParseException {
        return rewrite(PythonParser.parse(sourceText));
    }

    public RewriteOutcome rewrite(Module tree) {
        RewriteContext context = RewriteContext.forModule(tree);
        Module rewritten = new LoopRewriter(context).transformModule(tree);

        List<ImportRequirement> injected = context.importsToInject();
        if (!injected.isEmpty()) {
            rewritten = injectImports(rewritten, injected, context);
        }
        List<AppliedRewrite> applied = context.appliedRewrites();
        logger.debug("Rewrite pass applied {} rewrites, injected imports {}", applied.size(), injected);
        return new RewriteOutcome(rewritten, injected, applied);
    }

    /**
     * Insert import statements after the module docstring and any
     * {@code from __future__} imports, which must stay first.
     */
    static Module injectImports(Module module, List<ImportRequirement> imports, RewriteContext context) {
        List<Stmt> body = module.body();
        int insertAt = 0;
        if (!body.isEmpty() && AstUtility.isDocstring(body.get(0))) {
            insertAt = 1;
        }
        while (insertAt < body.size() && body.get(insertAt) instanceof ImportFrom from && from.isFutureImport()) {
            insertAt++;
        }
        List<Stmt> result = new ArrayList<>(body.subList(0, insertAt));
        for (ImportRequirement requirement : imports) {
            result.add(requirement.toImportStatement(context.bindingFor(requirement)));
        }
        result.addAll(body.subList(insertAt, body.size()));
        return module.withBody(result);
    }

    private final class LoopRewriter extends StatementTransformer {

        private final RewriteContext context;

        LoopRewriter(RewriteContext context) {
            this.context = context;
        }

        @Override
        protected List<Stmt> transformLoop(For loop) {
            if (context.isTransformed(loop)) {
                return List.of(loop);
            }
            for (LoopRewriteRule rule : rules) {
                RewriteResult result = rule.apply(loop, context);
                if (result instanceof RewriteResult.Replaced replaced) {
                    context.markTransformed(loop);
                    context.require(replaced.requiredImports());
                    AppliedRewrite applied = new AppliedRewrite(rule.name(), loop.line(), context.scopeOf(loop));
                    context.record(applied);
                    logger.info(applied.describe());
                    return replaced.statements();
                }
            }
            return List.of(descendInto(loop));
        }
    }
}
