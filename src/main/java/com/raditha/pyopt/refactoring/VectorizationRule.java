package com.raditha.pyopt.refactoring;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Position;
import com.raditha.pyopt.ast.Stmt;
import com.raditha.pyopt.ast.expr.Attribute;
import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BinaryOperator;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Constant;
import com.raditha.pyopt.ast.expr.Name;
import com.raditha.pyopt.ast.expr.Subscript;
import com.raditha.pyopt.ast.stmt.Assign;
import com.raditha.pyopt.ast.stmt.AugAssign;
import com.raditha.pyopt.ast.stmt.For;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces an element-wise update loop with one array operation:
 *
 * <pre>
 * for i in range(len(arr)):       arr = np.array(arr)
 *     arr[i] = arr[i] + 10   =&gt;   arr = arr + 10
 * </pre>
 *
 * The body must be that single assignment, or the augmented form
 * {@code arr[i] += 10}, with a numeric literal on the right and one of
 * {@code + - *}. The loop variable must not share the array's name. Anything
 * else, including an {@code async for}, leaves the loop alone.
 */
public class VectorizationRule implements LoopRewriteRule {

    private static final Logger logger = LoggerFactory.getLogger(VectorizationRule.class);

    public static final String NAME = "vectorize";

    private static final Set<BinaryOperator> ELEMENT_WISE = Set.of(
            BinaryOperator.ADD, BinaryOperator.SUB, BinaryOperator.MULT);

    /** The operator and literal of a matched update. */
    private record Update(BinaryOperator op, Constant operand) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RewriteResult apply(For loop, RewriteContext context) {
        if (loop.isAsync()) {
            return decline(loop, "loop is async");
        }
        if (!(loop.target() instanceof Name index)) {
            return decline(loop, "target is not a simple name");
        }
        if (!loop.orelse().isEmpty()) {
            return decline(loop, "loop has an else block");
        }
        Optional<String> array = rangeOfLength(loop.iter());
        if (array.isEmpty()) {
            return decline(loop, "source is not range(len(name))");
        }
        if (index.id().equals(array.get())) {
            return decline(loop, "loop variable shadows the array '" + index.id() + "'");
        }
        if (loop.body().size() != 1) {
            return decline(loop, "body has more than one statement");
        }
        Update update = matchUpdate(loop.body().get(0), array.get(), index.id());
        if (update == null) {
            return decline(loop, "body is not an element-wise update with a numeric literal");
        }

        Position position = loop.position();
        String arrayName = array.get();
        Expr constructor = new Attribute(position,
                new Name(position, context.bindingFor(ImportRequirement.VECTOR_ARRAY)), "array");
        Stmt convert = new Assign(position, new Name(position, arrayName),
                new Call(position, constructor, List.of(new Name(position, arrayName))));
        Stmt compute = new Assign(position, new Name(position, arrayName),
                new BinOp(position, new Name(position, arrayName), update.op(), update.operand()));
        return RewriteResult.replaced(List.of(convert, compute), ImportRequirement.VECTOR_ARRAY);
    }

    /**
     * The array name of {@code range(len(name))}, each call with exactly one
     * positional argument.
     */
    private static Optional<String> rangeOfLength(Expr iter) {
        if (iter instanceof Call range && range.callsName("range") && isSingleArgument(range)
                && range.args().get(0) instanceof Call len && len.callsName("len") && isSingleArgument(len)
                && len.args().get(0) instanceof Name array) {
            return Optional.of(array.id());
        }
        return Optional.empty();
    }

    private static boolean isSingleArgument(Call call) {
        return call.args().size() == 1 && call.keywords().isEmpty();
    }

    private static @Nullable Update matchUpdate(Stmt stmt, String array, String index) {
        if (stmt instanceof Assign assign
                && assign.targets().size() == 1
                && isElement(assign.targets().get(0), array, index)
                && assign.value() instanceof BinOp binOp
                && ELEMENT_WISE.contains(binOp.op())
                && isElement(binOp.left(), array, index)
                && binOp.right() instanceof Constant constant
                && constant.isNumeric()) {
            return new Update(binOp.op(), constant);
        }
        if (stmt instanceof AugAssign aug
                && isElement(aug.target(), array, index)
                && ELEMENT_WISE.contains(aug.op())
                && aug.value() instanceof Constant constant
                && constant.isNumeric()) {
            return new Update(aug.op(), constant);
        }
        return null;
    }

    /**
     * {@code array[index]} with both parts plain names.
     */
    private static boolean isElement(Expr expr, String array, String index) {
        return expr instanceof Subscript subscript
                && subscript.value() instanceof Name a && a.id().equals(array)
                && subscript.slice() instanceof Name i && i.id().equals(index);
    }

    private static RewriteResult decline(For loop, String reason) {
        logger.debug("Line {}: not vectorizing, {}", loop.line(), reason);
        return RewriteResult.unchanged(loop);
    }
}
