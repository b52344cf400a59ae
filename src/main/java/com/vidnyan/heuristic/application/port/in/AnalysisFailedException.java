package com.vidnyan.heuristic.application.port.in;

/**
 * Thrown when a page cannot be scored at all, e.g. no features were captured.
 * Never masked by default values.
 */
public class AnalysisFailedException extends RuntimeException {

    public AnalysisFailedException(String message) {
        super(message);
    }

    public AnalysisFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
