package com.raditha.pyopt.workflow;

import com.raditha.pyopt.config.OptimizerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectScannerTest {

    @TempDir
    Path tempDir;

    private Path touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "pass\n");
        return file;
    }

    @Test
    void testFindsPythonFilesSorted() throws IOException {
        Path b = touch("pkg/b.py");
        Path a = touch("a.py");
        Path c = touch("pkg/sub/c.py");
        touch("README.md");
        touch("pkg/data.pyc");

        List<Path> scripts = new ProjectScanner(OptimizerConfig.defaults()).findScripts(tempDir);
        assertEquals(List.of(a, b, c), scripts);
    }

    @Test
    void testDefaultExclusions() throws IOException {
        Path kept = touch("app/main.py");
        touch(".venv/lib/site.py");
        touch("app/__pycache__/main.py");
        touch("optimized_code/main_optimized.py");

        assertEquals(List.of(kept), new ProjectScanner(OptimizerConfig.defaults()).findScripts(tempDir));
    }

    @Test
    void testCustomExclusions() throws IOException {
        Path kept = touch("src/job.py");
        touch("tests/test_job.py");
        OptimizerConfig config = new OptimizerConfig(1000, "out", "python3", 60, false, true, true,
                List.of("tests/**"));

        assertEquals(List.of(kept), new ProjectScanner(config).findScripts(tempDir));
    }

    @Test
    void testRootMustBeADirectory() throws IOException {
        Path file = touch("single.py");
        ProjectScanner scanner = new ProjectScanner(OptimizerConfig.defaults());
        assertThrows(IOException.class, () -> scanner.findScripts(file));
        assertThrows(IOException.class, () -> scanner.findScripts(tempDir.resolve("missing")));
    }
}
