package io.marcfilter.error;

import io.marcfilter.runtime.PipelineResult;

/**
 * Raised when record failures exceed the configured budget. Carries the counters reached
 * at the time of the abort.
 */
public class PipelineAbortedException extends RuntimeException {
    private final transient PipelineResult result;

    public PipelineAbortedException(String message, PipelineResult result, Throwable cause) {
        super(message, cause);
        this.result = result;
    }

    public PipelineResult result() { return result; }
}
