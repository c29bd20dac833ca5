package com.raditha.pyopt.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.pyopt.analyzer.AnalysisResult;
import com.raditha.pyopt.model.HighIterationLoop;
import com.raditha.pyopt.model.NestedLoop;
import com.raditha.pyopt.model.RepeatedComputation;
import com.raditha.pyopt.model.VariableBoundLoop;
import com.raditha.pyopt.refactoring.AppliedRewrite;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Exports findings as JSON for tooling and historical tracking.
 */
public class FindingsExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Findings and rewrites for one script.
     *
     * @param optimizedFile where the rewritten script was written, empty in dry-run mode
     */
    public record FileFindings(
            String file,
            Optional<String> optimizedFile,
            List<NestedLoop> nestedLoops,
            List<HighIterationLoop> highIterations,
            List<RepeatedComputation> repeatedComputations,
            List<String> vectorizationCandidates,
            List<VariableBoundLoop> variableBoundLoops,
            List<AppliedRewrite> appliedRewrites) {

        public static FileFindings of(String file, AnalysisResult result, List<AppliedRewrite> rewrites,
                                      Optional<String> optimizedFile) {
            return new FileFindings(file, optimizedFile, result.nestedLoops(), result.highIterations(),
                    result.repeatedComputations(), result.vectorizationCandidates(),
                    result.variableBoundLoops(), rewrites);
        }
    }

    /**
     * A run over one or more scripts.
     */
    public record FindingsDocument(LocalDateTime timestamp, int totalFiles, int totalFindings,
                                   List<FileFindings> files) {
    }

    public FindingsDocument buildDocument(List<FileFindings> files) {
        int total = files.stream()
                .mapToInt(f -> f.nestedLoops().size() + f.highIterations().size()
                        + f.repeatedComputations().size() + f.variableBoundLoops().size())
                .sum();
        return new FindingsDocument(LocalDateTime.now(), files.size(), total, files);
    }

    public String toJson(FindingsDocument document) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    /**
     * Export findings to a JSON file.
     */
    public void exportToJson(FindingsDocument document, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), document);
    }
}
