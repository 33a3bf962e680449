package com.substitution.solver.report;

/**
 * Raised when the key report template cannot be loaded or processed.
 */
public class ReportRenderingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
