package com.raditha.pyopt.report;

import com.raditha.pyopt.analyzer.AnalysisResult;
import com.raditha.pyopt.model.Finding;
import com.raditha.pyopt.model.NestedLoop;
import com.raditha.pyopt.model.RepeatedComputation;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns detector findings into the sentences shown in reports.
 * <p>
 * Repeated computations are shown with the operation as source text rather
 * than its structural dump.
 */
public class SuggestionFormatter {

    /**
     * Static analysis suggestions: high iteration loops, then repeated
     * computations, then variable bound notes.
     */
    public List<String> formatSuggestions(AnalysisResult result) {
        List<String> lines = new ArrayList<>();
        for (Finding finding : result.suggestions()) {
            lines.add(format(finding));
        }
        lines.addAll(result.vectorizationCandidates());
        result.variableBoundLoops().forEach(v -> lines.add(format(v)));
        return lines;
    }

    public String format(Finding finding) {
        if (finding instanceof RepeatedComputation rc) {
            return String.format("Line %d: Consider caching repeated computation '%s' (evaluated in the loop at line %d).",
                    rc.line(), rc.expressionSource(), rc.loopLine());
        }
        return finding.message();
    }

    /**
     * Advice for a nested loop, depending on how deep it sits.
     */
    public String nestedLoopAdvice(NestedLoop loop) {
        if (loop.depth() == 1) {
            return "Consider flattening with itertools.product.";
        }
        return "Deep nesting; consider restructuring the data or vectorizing the inner loops.";
    }
}
