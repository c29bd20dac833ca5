package com.raditha.pyopt.config;

import java.util.List;

/**
 * Configuration for loop analysis and rewriting.
 *
 * @param highIterationThreshold a literal {@code range} bound above this is reported
 * @param outputDirectory        directory receiving reports and optimized scripts
 * @param pythonExecutable       interpreter used for profiling
 * @param profileTimeoutSeconds  upper bound on each profiling run
 * @param profilingEnabled       run the runtime and memory profilers
 * @param flattenEnabled         apply the loop flattening rule
 * @param vectorizeEnabled       apply the vectorization rule
 * @param excludePatterns        file patterns to skip when scanning a directory (glob format)
 */
public record OptimizerConfig(
        long highIterationThreshold,
        String outputDirectory,
        String pythonExecutable,
        int profileTimeoutSeconds,
        boolean profilingEnabled,
        boolean flattenEnabled,
        boolean vectorizeEnabled,
        List<String> excludePatterns) {

    public static final long DEFAULT_THRESHOLD = 1000;
    public static final String DEFAULT_OUTPUT_DIRECTORY = "optimized_code";
    public static final String DEFAULT_PYTHON = "python3";
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    /**
     * Validate configuration.
     */
    public OptimizerConfig {
        if (highIterationThreshold < 0) {
            throw new IllegalArgumentException("highIterationThreshold must be >= 0");
        }
        if (outputDirectory == null || outputDirectory.isBlank()) {
            throw new IllegalArgumentException("outputDirectory cannot be empty");
        }
        if (pythonExecutable == null || pythonExecutable.isBlank()) {
            throw new IllegalArgumentException("pythonExecutable cannot be empty");
        }
        if (profileTimeoutSeconds < 1) {
            throw new IllegalArgumentException("profileTimeoutSeconds must be >= 1");
        }
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Defaults: threshold 1000, both rules on, profiling on, output into
     * {@code optimized_code}.
     */
    public static OptimizerConfig defaults() {
        return new OptimizerConfig(
                DEFAULT_THRESHOLD,
                DEFAULT_OUTPUT_DIRECTORY,
                DEFAULT_PYTHON,
                DEFAULT_TIMEOUT_SECONDS,
                true,
                true,
                true,
                defaultExcludePatterns());
    }

    /**
     * Static analysis only: no profiling runs, rules still applied.
     */
    public static OptimizerConfig staticOnly() {
        return defaults().withProfiling(false);
    }

    public OptimizerConfig withProfiling(boolean enabled) {
        return new OptimizerConfig(highIterationThreshold, outputDirectory, pythonExecutable,
                profileTimeoutSeconds, enabled, flattenEnabled, vectorizeEnabled, excludePatterns);
    }

    public OptimizerConfig withOutputDirectory(String directory) {
        return new OptimizerConfig(highIterationThreshold, directory, pythonExecutable,
                profileTimeoutSeconds, profilingEnabled, flattenEnabled, vectorizeEnabled, excludePatterns);
    }

    /**
     * Directories that never hold sources worth optimizing.
     */
    static List<String> defaultExcludePatterns() {
        return List.of(
                "**/.venv/**",
                "**/venv/**",
                "**/__pycache__/**",
                "**/.git/**",
                "**/optimized_code/**");
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Glob matching with {@code **} and {@code *} wildcards. A leading
     * {@code **}{@code /} also matches paths without a directory part.
     */
    private static boolean matchesGlobPattern(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("**/", "\u0001")
                .replace("**", "\u0002")
                .replace("*", "[^/]*")
                .replace("\u0001", "(?:.*/)?")
                .replace("\u0002", ".*");
        return path.matches(regex);
    }
}
