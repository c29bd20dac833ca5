package com.raditha.pyopt.workflow;

import com.raditha.pyopt.analyzer.AnalysisResult;
import com.raditha.pyopt.refactoring.RewriteOutcome;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Everything produced for one script.
 *
 * @param sourceFile      the analyzed script
 * @param analysis        detector findings
 * @param rewrite         rewrite pass result
 * @param optimizedSource the rewritten tree printed as source
 * @param diff            unified diff from the original to the optimized source, empty if unchanged
 * @param dynamicAnalysis profiler output, or an explanation why there is none
 * @param reportFile      the written HTML report
 * @param optimizedFile   the written optimized script, empty in dry-run mode
 */
public record FileOptimizationResult(
        Path sourceFile,
        AnalysisResult analysis,
        RewriteOutcome rewrite,
        String optimizedSource,
        String diff,
        String dynamicAnalysis,
        Path reportFile,
        Optional<Path> optimizedFile) {

    public boolean isChanged() {
        return rewrite.isChanged();
    }
}
