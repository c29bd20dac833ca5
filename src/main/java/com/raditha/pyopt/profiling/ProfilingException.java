package com.raditha.pyopt.profiling;

/**
 * Raised when a profiling run cannot be started, times out or exits with an
 * error.
 */
public class ProfilingException extends Exception {

    public ProfilingException(String message) {
        super(message);
    }

    public ProfilingException(String message, Throwable cause) {
        super(message, cause);
    }
}
