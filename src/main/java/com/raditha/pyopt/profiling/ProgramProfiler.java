package com.raditha.pyopt.profiling;

import java.nio.file.Path;

/**
 * Runs a Python script and reports on its execution.
 */
public interface ProgramProfiler {

    /**
     * Short label used in logs and report headings.
     */
    String name();

    /**
     * Execute the script and return the profile as text.
     *
     * @throws ProfilingException if the script could not be run to completion
     */
    String profile(Path script) throws ProfilingException;
}
