package com.raditha.pyopt.profiling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external interpreter with stdout and stderr merged.
 * <p>
 * Output is collected in a temporary file so that a process which prints a
 * lot cannot block on a full pipe while we wait for it.
 */
public class PythonProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(PythonProcessRunner.class);

    private final String executable;
    private final long timeoutSeconds;

    /**
     * Output and exit status of a completed process.
     */
    public record ProcessResult(int exitCode, String output) {
        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    public PythonProcessRunner(String executable, long timeoutSeconds) {
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be >= 1, got " + timeoutSeconds);
        }
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getExecutable() {
        return executable;
    }

    /**
     * Run the executable with the given arguments.
     *
     * @param workingDirectory directory the process starts in, null for the current one
     * @throws ProfilingException if the process cannot be started or does not finish in time
     */
    public ProcessResult run(Path workingDirectory, List<String> arguments) throws ProfilingException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(arguments);

        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("pyopt-profile", ".out");
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            pb.redirectErrorStream(true);
            pb.redirectOutput(outputFile.toFile());

            logger.debug("Running {}", command);
            Process process = pb.start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ProfilingException(executable + " did not finish within " + timeoutSeconds + " seconds");
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            return new ProcessResult(process.exitValue(), output);
        } catch (IOException e) {
            throw new ProfilingException("Failed to run " + executable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProfilingException("Interrupted while running " + executable, e);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
