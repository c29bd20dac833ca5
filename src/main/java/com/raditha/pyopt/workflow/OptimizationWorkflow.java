package com.raditha.pyopt.workflow;

import com.raditha.pyopt.analyzer.AnalysisResult;
import com.raditha.pyopt.analyzer.PatternDetector;
import com.raditha.pyopt.ast.Module;
import com.raditha.pyopt.ast.SourcePrinter;
import com.raditha.pyopt.config.OptimizerConfig;
import com.raditha.pyopt.parser.PythonParser;
import com.raditha.pyopt.parser.SourceParseException;
import com.raditha.pyopt.profiling.MemoryProfiler;
import com.raditha.pyopt.profiling.ProgramProfiler;
import com.raditha.pyopt.profiling.ProfilingException;
import com.raditha.pyopt.profiling.PythonProcessRunner;
import com.raditha.pyopt.profiling.RuntimeProfiler;
import com.raditha.pyopt.refactoring.RewriteEngine;
import com.raditha.pyopt.refactoring.RewriteOutcome;
import com.raditha.pyopt.report.DiffGenerator;
import com.raditha.pyopt.report.HtmlReportGenerator;
import com.raditha.pyopt.report.SuggestionFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs analysis, rewriting, profiling and reporting for scripts.
 * <p>
 * For each script the workflow writes {@code <stem>_report.html} and, unless
 * it is a dry run, {@code <stem>_optimized.py} into the output directory.
 * Profiling failures are reported in the dynamic analysis section and do not
 * stop the run.
 */
public class OptimizationWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(OptimizationWorkflow.class);

    static final String PROFILING_DISABLED = "Profiling disabled.";

    private final OptimizerConfig config;
    private final boolean dryRun;
    private final PatternDetector detector;
    private final RewriteEngine engine;
    private final List<ProgramProfiler> profilers;
    private final HtmlReportGenerator reportGenerator;
    private final SuggestionFormatter formatter;
    private final DiffGenerator diffGenerator;

    /**
     * Create a workflow that profiles with the configured interpreter.
     */
    public OptimizationWorkflow(OptimizerConfig config, boolean dryRun) {
        this(config, dryRun, defaultProfilers(config));
    }

    /**
     * Create a workflow with the given profilers, run in order.
     */
    public OptimizationWorkflow(OptimizerConfig config, boolean dryRun, List<ProgramProfiler> profilers) {
        this.config = config;
        this.dryRun = dryRun;
        this.detector = new PatternDetector(config.highIterationThreshold());
        this.engine = RewriteEngine.withRules(config.flattenEnabled(), config.vectorizeEnabled());
        this.profilers = List.copyOf(profilers);
        this.formatter = new SuggestionFormatter();
        this.reportGenerator = new HtmlReportGenerator(HtmlReportGenerator.DEFAULT_TEMPLATE, formatter);
        this.diffGenerator = new DiffGenerator();
    }

    private static List<ProgramProfiler> defaultProfilers(OptimizerConfig config) {
        PythonProcessRunner runner = new PythonProcessRunner(config.pythonExecutable(),
                config.profileTimeoutSeconds());
        return List.of(new RuntimeProfiler(runner), new MemoryProfiler(runner));
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Optimize one script, writing into the configured output directory.
     *
     * @throws SourceParseException if the script is not valid Python
     * @throws IOException          if the script cannot be read or the outputs cannot be written
     */
    public FileOptimizationResult optimize(Path script) throws SourceParseException, IOException {
        return optimize(script, Path.of(config.outputDirectory()));
    }

    /**
     * Optimize every script below {@code root}. Output files mirror the
     * directory layout under the output directory. Scripts that fail to parse
     * or are not UTF-8 text are logged and skipped.
     */
    public List<FileOptimizationResult> optimizeProject(Path root) throws IOException {
        List<Path> scripts = new ProjectScanner(config).findScripts(root);
        logger.info("Found {} Python files under {}", scripts.size(), root);

        Path outputRoot = Path.of(config.outputDirectory());
        List<FileOptimizationResult> results = new ArrayList<>();
        for (Path script : scripts) {
            Path relativeDir = root.relativize(script).getParent();
            Path target = relativeDir == null ? outputRoot : outputRoot.resolve(relativeDir);
            try {
                results.add(optimize(script, target));
            } catch (SourceParseException e) {
                logger.warn("Skipping {}: {}", script, e.getMessage());
            } catch (CharacterCodingException e) {
                logger.warn("Skipping {}: not valid UTF-8 text ({})", script, e.getMessage());
            }
        }
        return results;
    }

    FileOptimizationResult optimize(Path script, Path outputDirectory) throws SourceParseException, IOException {
        String source = Files.readString(script, StandardCharsets.UTF_8);
        Module tree = PythonParser.parse(source);

        AnalysisResult analysis = detector.analyze(tree);
        RewriteOutcome outcome = engine.rewrite(tree);
        String optimizedSource = outcome.isChanged() ? SourcePrinter.print(outcome.tree()) : source;
        String fileName = script.getFileName().toString();
        String diff = diffGenerator.generateUnifiedDiff(fileName, source, optimizedSource,
                DiffGenerator.DEFAULT_CONTEXT_LINES);

        String dynamicAnalysis = profile(script);
        String report = reportGenerator.generate(fileName, formatter.formatSuggestions(analysis),
                analysis.nestedLoops(), dynamicAnalysis);

        Files.createDirectories(outputDirectory);
        String stem = stem(fileName);
        Path reportFile = outputDirectory.resolve(stem + "_report.html");
        Files.writeString(reportFile, report, StandardCharsets.UTF_8);

        Optional<Path> optimizedFile = Optional.empty();
        if (!dryRun) {
            Path target = outputDirectory.resolve(stem + "_optimized.py");
            Files.writeString(target, optimizedSource, StandardCharsets.UTF_8);
            optimizedFile = Optional.of(target);
        }

        logger.info("{}: {}; {} rewrites applied", fileName, analysis.getSummary(), outcome.appliedRewrites().size());
        return new FileOptimizationResult(script, analysis, outcome, optimizedSource, diff, dynamicAnalysis,
                reportFile, optimizedFile);
    }

    /**
     * Run every profiler on the original script and join their output.
     */
    private String profile(Path script) {
        if (!config.profilingEnabled()) {
            return PROFILING_DISABLED;
        }
        List<String> sections = new ArrayList<>();
        for (ProgramProfiler profiler : profilers) {
            try {
                sections.add(profiler.profile(script));
            } catch (ProfilingException e) {
                logger.warn("{} profiling of {} failed: {}", profiler.name(), script, e.getMessage());
                sections.add("Profiling (" + profiler.name() + ") unavailable: " + e.getMessage());
            }
        }
        return String.join("\n", sections);
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
