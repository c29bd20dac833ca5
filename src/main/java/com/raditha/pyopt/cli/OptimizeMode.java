package com.raditha.pyopt.cli;

/**
 * What the optimizer does with the rewritten source.
 */
public enum OptimizeMode {
    /**
     * Write the optimized script next to the report.
     */
    WRITE,

    /**
     * Preview the rewrite as a diff. Only the report is written.
     */
    DRY_RUN;

    /**
     * Convert a string value to an OptimizeMode.
     *
     * @param value the string value to convert (case-insensitive)
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static OptimizeMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OptimizeMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "write" -> WRITE;
            case "dry-run" -> DRY_RUN;
            default -> throw new IllegalArgumentException(
                    "Invalid mode: " + value + ". Must be: write or dry-run");
        };
    }

    public String toCliString() {
        return switch (this) {
            case WRITE -> "write";
            case DRY_RUN -> "dry-run";
        };
    }
}
