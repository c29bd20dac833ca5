package com.raditha.pyopt.report;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.List;

/**
 * Generates unified diffs between a script and its optimized form.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    public static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Diff two versions of a script.
     *
     * @param fileName     name shown in the {@code ---}/{@code +++} headers
     * @param contextLines unchanged lines kept around each change
     * @return the unified diff, empty if the texts have the same lines
     */
    public String generateUnifiedDiff(String fileName, String original, String optimized, int contextLines) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = optimized.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
