package com.raditha.pyopt.profiling;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Peak memory of a script as traced by Python's tracemalloc module.
 */
public class MemoryProfiler implements ProgramProfiler {

    static final String TRACER = String.join("\n",
            "import runpy, sys, tracemalloc",
            "tracemalloc.start()",
            "try:",
            "    runpy.run_path(sys.argv[1], run_name='__main__')",
            "finally:",
            "    peak = tracemalloc.get_traced_memory()[1]",
            "    print('Peak memory usage: %.2f MB' % (peak / (1024 * 1024)))");

    private static final Pattern PEAK = Pattern.compile("Peak memory usage: ([0-9]+(?:\\.[0-9]+)?) MB");

    private final PythonProcessRunner runner;

    public MemoryProfiler(PythonProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String profile(Path script) throws ProfilingException {
        Path absolute = script.toAbsolutePath();
        PythonProcessRunner.ProcessResult result = runner.run(absolute.getParent(),
                List.of("-c", TRACER, absolute.toString()));
        if (!result.isSuccess()) {
            throw new ProfilingException("Memory profiling of " + script + " failed with exit code "
                    + result.exitCode() + ":\n" + result.output());
        }
        OptionalDouble peak = parsePeakMegabytes(result.output());
        if (peak.isEmpty()) {
            throw new ProfilingException("No peak memory figure in the output of " + script);
        }
        return format(peak.getAsDouble());
    }

    static String format(double megabytes) {
        return String.format(Locale.ROOT, "Peak memory usage: %.2f MB", megabytes);
    }

    /**
     * Find the last peak memory line in the process output. The script may
     * print the same phrase itself, the tracer always prints last.
     */
    static OptionalDouble parsePeakMegabytes(String output) {
        Matcher matcher = PEAK.matcher(output);
        OptionalDouble last = OptionalDouble.empty();
        while (matcher.find()) {
            last = OptionalDouble.of(Double.parseDouble(matcher.group(1)));
        }
        return last;
    }
}
