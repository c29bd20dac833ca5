package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.expr.Attribute;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Name;
import com.raditha.pyopt.ast.expr.TupleExpr;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.util.AstUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges two perfectly nested loops into one loop over the cross product of
 * their iteration sources:
 *
 * <pre>
 * for i in range(n):              for i, j in itertools.product(range(n), range(m)):
 *     for j in range(m):     =&gt;       body
 *         body
 * </pre>
 *
 * Applies only when the outer body is the inner loop and nothing else, both
 * targets are plain names, both sources are calls and neither loop is
 * {@code async} or has an {@code else} block. The inner source must not read
 * the outer variable, and the inner body must have no {@code break} of its
 * own. The inner body must also leave alone the outer variable and every name
 * the inner source reads: the flattened loop evaluates both sources once, up
 * front, and reassigns the outer variable on every iteration.
 */
public class LoopFlatteningRule implements LoopRewriteRule {

    private static final Logger logger = LoggerFactory.getLogger(LoopFlatteningRule.class);

    public static final String NAME = "flatten";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RewriteResult apply(For outer, RewriteContext context) {
        if (outer.body().size() != 1 || !(outer.body().get(0) instanceof For inner)) {
            return decline(outer, "outer body is not a single loop");
        }
        if (outer.isAsync() || inner.isAsync()) {
            return decline(outer, "a loop is async");
        }
        if (!(outer.target() instanceof Name outerVar) || !(inner.target() instanceof Name innerVar)) {
            return decline(outer, "loop targets are not simple names");
        }
        if (!(outer.iter() instanceof Call) || !(inner.iter() instanceof Call)) {
            return decline(outer, "iteration sources are not calls");
        }
        if (!outer.orelse().isEmpty() || !inner.orelse().isEmpty()) {
            return decline(outer, "a loop has an else block");
        }
        if (AstUtility.referencesName(inner.iter(), outerVar.id())) {
            return decline(outer, "inner source depends on '" + outerVar.id() + "'");
        }
        if (AstUtility.containsLoopBreak(inner.body())) {
            return decline(outer, "inner body breaks out of the inner loop");
        }
        Set<String> guarded = new TreeSet<>(AstUtility.namesIn(inner.iter()));
        guarded.add(outerVar.id());
        guarded.retainAll(AstUtility.boundNames(inner.body()));
        if (!guarded.isEmpty()) {
            return decline(outer, "inner body rebinds " + String.join(", ", guarded));
        }
        if (outerVar.id().equals(innerVar.id())) {
            logger.warn("Line {}: outer and inner loops both bind '{}'; the flattened loop keeps the inner value",
                    outer.line(), outerVar.id());
        }

        Position position = outer.iter().position();
        Expr product = new Attribute(position,
                new Name(position, context.bindingFor(ImportRequirement.CROSS_PRODUCT)), "product");
        Call source = new Call(position, product, List.of(outer.iter(), inner.iter()));
        TupleExpr target = new TupleExpr(outer.target().position(), List.of(outerVar, innerVar));

        For flattened = new For(outer.position(), target, source, inner.body());
        return RewriteResult.replaced(List.of(flattened), ImportRequirement.CROSS_PRODUCT);
    }

    private static RewriteResult decline(For loop, String reason) {
        logger.debug("Line {}: not flattening, {}", loop.line(), reason);
        return RewriteResult.unchanged(loop);
    }
}
