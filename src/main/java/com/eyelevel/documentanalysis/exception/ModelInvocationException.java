package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * Thrown when a single call to the language model fails or returns no usable text.
 * Callers decide whether to retry it or to record it as a failed extraction or analysis.
 */
public class ModelInvocationException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = 3418006422178795524L;

    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
