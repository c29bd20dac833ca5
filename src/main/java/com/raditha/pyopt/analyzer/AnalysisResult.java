package com.raditha.pyopt.analyzer;

import com.raditha.pyopt.model.Finding;
import com.raditha.pyopt.model.HighIterationLoop;
import com.raditha.pyopt.model.NestedLoop;
import com.raditha.pyopt.model.RepeatedComputation;
import com.raditha.pyopt.model.VariableBoundLoop;

import java.util.ArrayList;
import java.util.List;

/**
 * Findings of one detector pass, each list in document order.
 * <p>
 * {@code vectorizationCandidates} is reserved and always empty; vectorizable
 * loops are reported by the rewrite engine when it transforms them.
 */
public record AnalysisResult(
        List<NestedLoop> nestedLoops,
        List<HighIterationLoop> highIterations,
        List<RepeatedComputation> repeatedComputations,
        List<String> vectorizationCandidates,
        List<VariableBoundLoop> variableBoundLoops) {

    public AnalysisResult {
        nestedLoops = List.copyOf(nestedLoops);
        highIterations = List.copyOf(highIterations);
        repeatedComputations = List.copyOf(repeatedComputations);
        vectorizationCandidates = List.copyOf(vectorizationCandidates);
        variableBoundLoops = List.copyOf(variableBoundLoops);
    }

    public static AnalysisResult empty() {
        return new AnalysisResult(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    /**
     * Suggestions shown in the static analysis section of a report: high
     * iteration loops first, then repeated computations.
     */
    public List<Finding> suggestions() {
        List<Finding> result = new ArrayList<>(highIterations);
        result.addAll(repeatedComputations);
        return result;
    }

    public int totalFindings() {
        return nestedLoops.size() + highIterations.size() + repeatedComputations.size()
                + variableBoundLoops.size();
    }

    public boolean hasFindings() {
        return totalFindings() > 0;
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format("%d nested loops, %d high-iteration loops, %d repeated computations, %d variable bounds",
                nestedLoops.size(), highIterations.size(), repeatedComputations.size(), variableBoundLoops.size());
    }
}
