package com.raditha.pyopt.profiling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Uses the running JVM's own launcher as a stand-in executable so the tests
 * do not depend on a Python installation.
 */
class PythonProcessRunnerTest {

    @TempDir
    Path tempDir;

    private static String javaLauncher() {
        Optional<String> command = ProcessHandle.current().info().command();
        assumeTrue(command.isPresent(), "launcher path not available");
        return command.get();
    }

    @Test
    void testSuccessfulRunCapturesMergedOutput() throws ProfilingException {
        PythonProcessRunner runner = new PythonProcessRunner(javaLauncher(), 30);
        PythonProcessRunner.ProcessResult result = runner.run(tempDir, List.of("-version"));

        assertTrue(result.isSuccess());
        // -version prints to stderr
        assertTrue(result.output().contains("version"));
    }

    @Test
    void testNonZeroExit() throws ProfilingException {
        PythonProcessRunner runner = new PythonProcessRunner(javaLauncher(), 30);
        PythonProcessRunner.ProcessResult result = runner.run(null, List.of("-no-such-option"));

        assertFalse(result.isSuccess());
        assertNotEquals(0, result.exitCode());
    }

    @Test
    void testMissingExecutable() {
        PythonProcessRunner runner = new PythonProcessRunner(tempDir.resolve("no-such-python").toString(), 5);
        ProfilingException e = assertThrows(ProfilingException.class, () -> runner.run(tempDir, List.of("x.py")));
        assertNotNull(e.getCause());
    }

    @Test
    void testTimeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new PythonProcessRunner("python3", 0));
        assertEquals("python3", new PythonProcessRunner("python3", 1).getExecutable());
    }
}
