package com.raditha.pyopt.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerConfigTest {

    @Test
    void testDefaults() {
        OptimizerConfig config = OptimizerConfig.defaults();
        assertEquals(1000, config.highIterationThreshold());
        assertEquals("optimized_code", config.outputDirectory());
        assertEquals("python3", config.pythonExecutable());
        assertEquals(60, config.profileTimeoutSeconds());
        assertTrue(config.profilingEnabled());
        assertTrue(config.flattenEnabled());
        assertTrue(config.vectorizeEnabled());
        assertEquals(5, config.excludePatterns().size());
    }

    @Test
    void testStaticOnly() {
        OptimizerConfig config = OptimizerConfig.staticOnly();
        assertFalse(config.profilingEnabled());
        assertTrue(config.flattenEnabled());
        assertEquals(OptimizerConfig.defaults().excludePatterns(), config.excludePatterns());
    }

    @Test
    void testWithOutputDirectory() {
        OptimizerConfig config = OptimizerConfig.defaults().withOutputDirectory("build/out");
        assertEquals("build/out", config.outputDirectory());
        assertEquals(1000, config.highIterationThreshold());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new OptimizerConfig(-1, "out", "python3", 60, true, true, true, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new OptimizerConfig(10, " ", "python3", 60, true, true, true, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new OptimizerConfig(10, "out", "", 60, true, true, true, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new OptimizerConfig(10, "out", "python3", 0, true, true, true, List.of()));
    }

    @Test
    void testNullExcludePatternsBecomeEmpty() {
        OptimizerConfig config = new OptimizerConfig(0, "out", "python3", 1, false, false, false, null);
        assertEquals(List.of(), config.excludePatterns());
        assertFalse(config.shouldExclude("anything.py"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            ".venv/lib/site.py",
            "project/.venv/lib/site.py",
            "venv/bin/activate.py",
            "pkg/__pycache__/mod.py",
            "optimized_code/a_optimized.py",
            "nested\\venv\\x.py"
    })
    void testDefaultExclusions(String path) {
        assertTrue(OptimizerConfig.defaults().shouldExclude(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "main.py",
            "src/app/loops.py",
            "myvenv/x.py",
            "venv.py",
            "gitlab/.gitignore.py"
    })
    void testDefaultInclusions(String path) {
        assertFalse(OptimizerConfig.defaults().shouldExclude(path));
    }

    @Test
    void testSingleStarStaysInOneDirectory() {
        OptimizerConfig config = new OptimizerConfig(0, "out", "python3", 1, false, true, true,
                List.of("test_*.py", "**/gen/*.py"));
        assertTrue(config.shouldExclude("test_loops.py"));
        assertFalse(config.shouldExclude("tests/test_loops.py"));
        assertTrue(config.shouldExclude("a/b/gen/x.py"));
        assertTrue(config.shouldExclude("gen/x.py"));
        assertFalse(config.shouldExclude("gen/sub/x.py"));
        assertFalse(config.shouldExclude("testXloops.py.bak"));
    }
}
