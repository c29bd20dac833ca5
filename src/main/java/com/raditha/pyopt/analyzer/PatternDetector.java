package com.raditha.pyopt.analyzer;

import com.raditha.pyopt.ast.AstDumper;
import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.ParentIndex;
import com.raditha.pyopt.ast.SourcePrinter;
import com.raditha.pyopt.ast.VoidNodeVisitor;
import com.raditha.pyopt.ast.expr.BinOp;
import com.raditha.pyopt.ast.expr.BinaryOperator;
import com.raditha.pyopt.ast.expr.Call;
import com.raditha.pyopt.ast.expr.Constant;
import com.raditha.pyopt.ast.stmt.For;
import com.raditha.pyopt.model.HighIterationLoop;
import com.raditha.pyopt.model.NestedLoop;
import com.raditha.pyopt.model.RepeatedComputation;
import com.raditha.pyopt.model.VariableBoundLoop;
import com.raditha.pyopt.parser.PythonParser;
import com.raditha.pyopt.parser.SourceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only pass over a syntax tree that records loop related findings.
 * <p>
 * For every {@code for} loop it counts enclosing loops and inspects a
 * {@code range(N)} bound. For every addition or multiplication it looks for
 * the nearest enclosing loop. {@code async for} loops are not loops here: they
 * produce no findings and do not count as enclosing loops, though their bodies
 * are still searched. The tree is never modified and the detector keeps no
 * state between calls.
 */
public class PatternDetector {

    private static final Logger logger = LoggerFactory.getLogger(PatternDetector.class);

    public static final int DEFAULT_THRESHOLD = 1000;

    private final BigInteger threshold;

    /**
     * Create a detector with the default high-iteration threshold.
     */
    public PatternDetector() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold a {@code range} bound strictly greater than this is a high iteration loop
     */
    public PatternDetector(long threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative, got " + threshold);
        }
        this.threshold = BigInteger.valueOf(threshold);
    }

    /**
     * Parse and analyze source text.
     *
     * @throws SourceParseException if the text is not valid Python
     */
    public AnalysisResult analyze(String sourceText) throws SourceParseException {
        return analyze(PythonParser.parse(sourceText));
    }

    /**
     * Analyze an already parsed module.
     */
    public AnalysisResult analyze(Module module) {
        ParentIndex parents = ParentIndex.build(module);
        Collector collector = new Collector(parents);
        module.accept(collector, null);
        AnalysisResult result = collector.result();
        logger.debug("Detector pass over {} nodes: {}", parents.size(), result.getSummary());
        return result;
    }

    private static boolean isSyncLoop(Node node) {
        return node.kind() == NodeKind.FOR && !((For) node).isAsync();
    }

    private final class Collector extends VoidNodeVisitor<Void> {

        private final ParentIndex parents;
        private final List<NestedLoop> nestedLoops = new ArrayList<>();
        private final List<HighIterationLoop> highIterations = new ArrayList<>();
        private final List<RepeatedComputation> repeatedComputations = new ArrayList<>();
        private final List<VariableBoundLoop> variableBounds = new ArrayList<>();

        Collector(ParentIndex parents) {
            this.parents = parents;
        }

        @Override
        public Void visit(For n, Void arg) {
            if (!n.isAsync()) {
                int depth = parents.countAncestors(n, PatternDetector::isSyncLoop);
                if (depth > 0) {
                    nestedLoops.add(new NestedLoop(n.line(), depth));
                }
                inspectRangeBound(n);
            }
            visitChildren(n, arg);
            return null;
        }

        private void inspectRangeBound(For loop) {
            if (!(loop.iter() instanceof Call call) || !call.callsName("range")
                    || call.args().size() != 1 || !call.keywords().isEmpty()) {
                return;
            }
            Expr bound = call.args().get(0);
            Optional<BigInteger> value = bound instanceof Constant c ? c.integerValue() : Optional.empty();
            if (value.isEmpty()) {
                variableBounds.add(new VariableBoundLoop(loop.line(), SourcePrinter.printExpression(bound)));
            } else if (value.get().compareTo(threshold) > 0) {
                highIterations.add(new HighIterationLoop(loop.line(), value.get()));
            }
        }

        @Override
        public Void visit(BinOp n, Void arg) {
            if (n.op() == BinaryOperator.ADD || n.op() == BinaryOperator.MULT) {
                Optional<Node> loop = parents.nearestAncestor(n, PatternDetector::isSyncLoop);
                loop.ifPresent(l -> repeatedComputations.add(new RepeatedComputation(
                        n.line(), AstDumper.dump(n), SourcePrinter.printExpression(n), l.line())));
            }
            visitChildren(n, arg);
            return null;
        }

        AnalysisResult result() {
            return new AnalysisResult(nestedLoops, highIterations, repeatedComputations, List.of(), variableBounds);
        }
    }
}
