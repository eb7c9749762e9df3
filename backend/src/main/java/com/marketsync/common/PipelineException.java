package com.marketsync.common;

/**
 * Root of pipeline failures. Subclasses decide whether a failure is record-local or aborts the run.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
