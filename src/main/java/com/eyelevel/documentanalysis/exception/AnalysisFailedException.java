package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * Thrown when the analysis model call fails or returns no usable content.
 */
public class AnalysisFailedException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = 1851106934478502213L;

    public AnalysisFailedException(String message) {
        super(message);
    }

    public AnalysisFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
