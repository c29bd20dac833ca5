package com.raditha.pyopt.workflow;

import com.raditha.pyopt.config.OptimizerConfig;
import com.raditha.pyopt.parser.SourceParseException;
import com.raditha.pyopt.profiling.ProfilingException;
import com.raditha.pyopt.profiling.ProgramProfiler;
import com.raditha.pyopt.refactoring.AppliedRewrite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OptimizationWorkflowTest {

    @TempDir
    Path tempDir;

    private Path outputDir;
    private OptimizerConfig config;
    private ProgramProfiler profiler;

    @BeforeEach
    void setUp() throws ProfilingException {
        outputDir = tempDir.resolve("out");
        config = OptimizerConfig.defaults().withOutputDirectory(outputDir.toString());
        profiler = mock(ProgramProfiler.class);
        when(profiler.name()).thenReturn("runtime");
        when(profiler.profile(any())).thenReturn("10 function calls in 0.001 seconds");
    }

    static Path copyScript(String name, Path directory) throws IOException {
        Path target = directory.resolve(name);
        Files.createDirectories(directory);
        try (InputStream in = OptimizationWorkflowTest.class.getResourceAsStream("/scripts/" + name)) {
            assertNotNull(in, "missing test script " + name);
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void testWriteModeProducesReportAndScript() throws Exception {
        Path script = copyScript("loops.py", tempDir);
        FileOptimizationResult result = new OptimizationWorkflow(config, false, List.of(profiler)).optimize(script);

        assertTrue(result.isChanged());
        assertEquals(List.of(new AppliedRewrite("flatten", 6, "<module>"),
                new AppliedRewrite("vectorize", 11, "<module>")), result.rewrite().appliedRewrites());
        assertEquals(outputDir.resolve("loops_report.html"), result.reportFile());
        assertEquals(outputDir.resolve("loops_optimized.py"), result.optimizedFile().orElseThrow());

        String optimized = Files.readString(outputDir.resolve("loops_optimized.py"));
        assertEquals(result.optimizedSource(), optimized);
        assertTrue(optimized.contains("for i, j in itertools.product(range(5), range(5)):\n"));
        assertTrue(optimized.contains("arr = np.array(arr)\narr = arr + 10\n"));
        assertTrue(optimized.startsWith("\"\"\"Sample workload with loops the optimizer can rewrite.\"\"\"\n"
                + "import itertools\nimport numpy as np\n"));

        String report = Files.readString(result.reportFile());
        assertTrue(report.contains("Optimization Report: loops.py"));
        assertTrue(report.contains("range(5000)"));
        assertTrue(report.contains("<tr><td>7</td><td>1</td>"));
        assertTrue(report.contains("10 function calls in 0.001 seconds"));

        assertTrue(result.diff().contains("+import itertools"));
        assertEquals("10 function calls in 0.001 seconds", result.dynamicAnalysis());
    }

    @Test
    void testDryRunWritesOnlyTheReport() throws Exception {
        Path script = copyScript("loops.py", tempDir);
        OptimizationWorkflow workflow = new OptimizationWorkflow(config, true, List.of(profiler));
        FileOptimizationResult result = workflow.optimize(script);

        assertTrue(workflow.isDryRun());
        assertTrue(result.optimizedFile().isEmpty());
        assertTrue(Files.exists(outputDir.resolve("loops_report.html")));
        assertFalse(Files.exists(outputDir.resolve("loops_optimized.py")));
        assertFalse(result.diff().isEmpty());
    }

    @Test
    void testProfilerFailureIsReported() throws Exception {
        when(profiler.profile(any())).thenThrow(new ProfilingException("exit code 1"));
        ProgramProfiler memory = mock(ProgramProfiler.class);
        when(memory.name()).thenReturn("memory");
        when(memory.profile(any())).thenReturn("Peak memory usage: 0.10 MB");

        Path script = copyScript("loops.py", tempDir);
        FileOptimizationResult result = new OptimizationWorkflow(config, false, List.of(profiler, memory))
                .optimize(script);

        assertEquals("Profiling (runtime) unavailable: exit code 1\nPeak memory usage: 0.10 MB",
                result.dynamicAnalysis());
        assertTrue(Files.readString(result.reportFile()).contains("Profiling (runtime) unavailable: exit code 1"));
    }

    @Test
    void testProfilingDisabled() throws Exception {
        Path script = copyScript("loops.py", tempDir);
        FileOptimizationResult result = new OptimizationWorkflow(config.withProfiling(false), false,
                List.of(profiler)).optimize(script);

        assertEquals(OptimizationWorkflow.PROFILING_DISABLED, result.dynamicAnalysis());
        verify(profiler, never()).profile(any());
    }

    @Test
    void testUnchangedScriptKeepsOriginalText() throws Exception {
        Path script = tempDir.resolve("plain.py");
        String source = "# a comment the printer would drop\nfor row in rows:\n    print(row)  # trailing\n";
        Files.writeString(script, source);

        FileOptimizationResult result = new OptimizationWorkflow(config, false, List.of(profiler)).optimize(script);

        assertFalse(result.isChanged());
        assertEquals(source, result.optimizedSource());
        assertEquals(source, Files.readString(outputDir.resolve("plain_optimized.py")));
        assertEquals("", result.diff());
    }

    @Test
    void testRulesCanBeDisabled() throws Exception {
        OptimizerConfig noRules = new OptimizerConfig(1000, outputDir.toString(), "python3", 60, false,
                false, false, List.of());
        Path script = copyScript("loops.py", tempDir);
        FileOptimizationResult result = new OptimizationWorkflow(noRules, false).optimize(script);

        assertFalse(result.isChanged());
        assertEquals(Files.readString(script), result.optimizedSource());
        assertEquals(1, result.analysis().highIterations().size());
    }

    @Test
    void testSyntaxErrorPropagatesForSingleFile() throws Exception {
        Path script = copyScript("broken.py", tempDir);
        OptimizationWorkflow workflow = new OptimizationWorkflow(config, false, List.of(profiler));

        SourceParseException e = assertThrows(SourceParseException.class, () -> workflow.optimize(script));
        assertEquals(1, e.getLine());
        assertFalse(Files.exists(outputDir.resolve("broken_report.html")));
    }

    @Test
    void testProjectModeMirrorsDirectoriesAndSkipsBrokenFiles() throws Exception {
        Path project = tempDir.resolve("project");
        copyScript("loops.py", project);
        copyScript("loops.py", project.resolve("pkg"));
        copyScript("broken.py", project.resolve("pkg"));
        copyScript("loops.py", project.resolve(".venv"));

        List<FileOptimizationResult> results = new OptimizationWorkflow(config, false, List.of(profiler))
                .optimizeProject(project);

        assertEquals(2, results.size());
        assertTrue(Files.exists(outputDir.resolve("loops_report.html")));
        assertTrue(Files.exists(outputDir.resolve("pkg/loops_report.html")));
        assertTrue(Files.exists(outputDir.resolve("pkg/loops_optimized.py")));
        assertFalse(Files.exists(outputDir.resolve("pkg/broken_report.html")));
        assertFalse(Files.exists(outputDir.resolve(".venv")));
    }

    @Test
    void testProjectModeSkipsFilesThatAreNotUtf8() throws Exception {
        Path project = tempDir.resolve("project");
        copyScript("loops.py", project);
        Files.write(project.resolve("latin1.py"), new byte[]{'s', ' ', '=', ' ', '\'', (byte) 0xE9, '\'', '\n'});

        List<FileOptimizationResult> results = new OptimizationWorkflow(config, false, List.of(profiler))
                .optimizeProject(project);

        assertEquals(1, results.size());
        assertEquals("loops.py", results.get(0).sourceFile().getFileName().toString());
        assertFalse(Files.exists(outputDir.resolve("latin1_report.html")));
    }

    @Test
    void testNonUtf8SingleFileIsAnIoError() throws Exception {
        Path script = tempDir.resolve("latin1.py");
        Files.write(script, new byte[]{'s', ' ', '=', ' ', '\'', (byte) 0xE9, '\'', '\n'});
        OptimizationWorkflow workflow = new OptimizationWorkflow(config, false, List.of(profiler));

        assertThrows(CharacterCodingException.class, () -> workflow.optimize(script));
    }

    @Test
    void testStem() {
        assertEquals("loops", OptimizationWorkflow.stem("loops.py"));
        assertEquals("a.b", OptimizationWorkflow.stem("a.b.py"));
        assertEquals(".hidden", OptimizationWorkflow.stem(".hidden"));
        assertEquals("script", OptimizationWorkflow.stem("script"));
    }
}
