package com.raditha.pyopt.workflow;

import com.raditha.pyopt.config.OptimizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds the Python scripts below a directory.
 */
public class ProjectScanner {

    private static final Logger logger = LoggerFactory.getLogger(ProjectScanner.class);

    private final OptimizerConfig config;

    public ProjectScanner(OptimizerConfig config) {
        this.config = config;
    }

    /**
     * All {@code *.py} files under {@code root} that no exclude pattern
     * matches, sorted by path. Patterns are matched against the path relative
     * to {@code root} using forward slashes.
     */
    public List<Path> findScripts(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".py"))
                    .filter(p -> !isExcluded(root, p))
                    .sorted()
                    .toList();
        }
    }

    private boolean isExcluded(Path root, Path file) {
        String relative = root.relativize(file).toString().replace('\\', '/');
        if (config.shouldExclude(relative)) {
            logger.debug("Excluding {}", relative);
            return true;
        }
        return false;
    }
}
