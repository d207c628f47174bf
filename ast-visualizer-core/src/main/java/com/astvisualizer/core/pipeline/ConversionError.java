package com.astvisualizer.core.pipeline;

/**
 * Reasons a conversion run fails. All of them end the run.
 */
public enum ConversionError {
    /** No input path was given */
    MISSING_INPUT(2),

    /** The input path does not exist or cannot be read */
    FILE_NOT_FOUND(3),

    /** The input has no content lines after header stripping */
    EMPTY_OR_MALFORMED(4),

    /** The rendering backend failed or does not support the requested format */
    RENDER_ERROR(5);

    private final int exitCode;

    ConversionError(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * Returns the process exit code for this error.
     *
     * @return non-zero exit code
     */
    public int exitCode() {
        return exitCode;
    }
}
