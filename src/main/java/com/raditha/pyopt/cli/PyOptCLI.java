package com.raditha.pyopt.cli;

import com.raditha.pyopt.config.OptimizerConfig;
import com.raditha.pyopt.config.OptimizerSettings;
import com.raditha.pyopt.parser.SourceParseException;
import com.raditha.pyopt.refactoring.AppliedRewrite;
import com.raditha.pyopt.report.FindingsExporter;
import com.raditha.pyopt.report.FindingsExporter.FileFindings;
import com.raditha.pyopt.workflow.FileOptimizationResult;
import com.raditha.pyopt.workflow.OptimizationWorkflow;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the loop optimizer.
 * <p>
 * Usage:
 * java -jar pyopt.jar [options] <script-or-directory>
 * <p>
 * Configuration priority: CLI arguments > optimizer.yml > defaults
 */
@Command(name = "pyopt", mixinStandardHelpOptions = true, version = "pyopt v1.0.0",
        description = "Python loop analyzer and optimizer")
@SuppressWarnings("java:S106")
public class PyOptCLI implements Callable<Integer> {

    @Parameters(index = "0", description = "Python script or directory to optimize", paramLabel = "<path>")
    private Path target;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--output", description = "Output directory (default: optimized_code)", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--threshold", description = "High iteration threshold (default: 1000)", paramLabel = "<n>")
    private Long threshold; // null = use YAML/default

    @Option(names = "--mode", description = "Output mode: write, dry-run", paramLabel = "<mode>",
            converter = OptimizeModeConverter.class)
    private OptimizeMode mode = OptimizeMode.WRITE;

    @Option(names = "--no-profile", description = "Skip runtime and memory profiling")
    private boolean noProfile = false;

    @Option(names = "--json", description = "Print findings as JSON instead of status lines")
    private boolean jsonOutput = false;

    @Option(names = "--python", description = "Python interpreter used for profiling", paramLabel = "<exe>")
    private String pythonExecutable;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Map<String, Object> yaml = configFile != null
                ? OptimizerSettings.loadConfigMap(new File(configFile))
                : OptimizerSettings.loadConfigMap();
        OptimizerConfig config = OptimizerSettings.loadConfig(yaml, threshold, outputPath, pythonExecutable,
                noProfile);

        OptimizationWorkflow workflow = new OptimizationWorkflow(config, mode == OptimizeMode.DRY_RUN);
        List<FileOptimizationResult> results = Files.isDirectory(target)
                ? workflow.optimizeProject(target)
                : List.of(workflow.optimize(target));

        if (jsonOutput) {
            printJson(results);
        } else {
            results.forEach(this::printStatus);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command line with the exit code mapping used by {@link #main}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new PyOptCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof SourceParseException) {
                commandLine.getErr().println("Syntax error: " + ex.getMessage());
                return 1;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threshold != null && threshold < 0) {
            throw new IllegalArgumentException("Threshold must be non-negative, got: " + threshold);
        }

        if (!Files.exists(target)) {
            throw new IllegalArgumentException("Input not found: " + target);
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private void printStatus(FileOptimizationResult result) {
        for (AppliedRewrite rewrite : result.rewrite().appliedRewrites()) {
            System.out.println(rewrite.describe());
        }
        if (mode == OptimizeMode.DRY_RUN && !result.diff().isEmpty()) {
            System.out.println(result.diff());
        }
        System.out.printf("Optimization complete. Report saved as '%s'.%n", result.reportFile());
        result.optimizedFile().ifPresent(p -> System.out.printf("Optimized code saved as '%s'.%n", p));
    }

    private static void printJson(List<FileOptimizationResult> results) throws IOException {
        FindingsExporter exporter = new FindingsExporter();
        List<FileFindings> files = results.stream()
                .map(r -> FileFindings.of(r.sourceFile().toString(), r.analysis(), r.rewrite().appliedRewrites(),
                        r.optimizedFile().map(Path::toString)))
                .toList();
        System.out.println(exporter.toJson(exporter.buildDocument(files)));
    }

    /**
     * Custom converter for OptimizeMode enum to handle CLI string values.
     */
    public static class OptimizeModeConverter implements ITypeConverter<OptimizeMode> {
        @Override
        public OptimizeMode convert(String value) throws Exception {
            return OptimizeMode.fromString(value);
        }
    }
}
