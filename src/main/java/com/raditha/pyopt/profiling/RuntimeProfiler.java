package com.raditha.pyopt.profiling;

import java.nio.file.Path;
import java.util.List;

/**
 * Cumulative-time profile of a script, produced by Python's cProfile module.
 */
public class RuntimeProfiler implements ProgramProfiler {

    private static final String STATS_HEADER = "function calls";

    private final PythonProcessRunner runner;

    public RuntimeProfiler(PythonProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public String name() {
        return "runtime";
    }

    @Override
    public String profile(Path script) throws ProfilingException {
        Path absolute = script.toAbsolutePath();
        PythonProcessRunner.ProcessResult result = runner.run(absolute.getParent(),
                List.of("-m", "cProfile", "-s", "cumtime", absolute.toString()));
        if (!result.isSuccess()) {
            throw new ProfilingException("Runtime profiling of " + script + " failed with exit code "
                    + result.exitCode() + ":\n" + result.output());
        }
        return extractStatistics(result.output());
    }

    /**
     * Drop whatever the script printed itself and keep the statistics table,
     * which starts at the "N function calls" line.
     */
    static String extractStatistics(String output) {
        int header = output.indexOf(STATS_HEADER);
        if (header < 0) {
            return output.strip();
        }
        int lineStart = output.lastIndexOf('\n', header) + 1;
        return output.substring(lineStart).strip();
    }
}
