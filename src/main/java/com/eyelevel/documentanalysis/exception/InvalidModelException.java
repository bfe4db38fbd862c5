package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * Thrown when an analysis is requested for a model variant other than the supported ones.
 */
public class InvalidModelException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = 3389263741200817204L;

    public InvalidModelException(String message) {
        super(message);
    }

    public InvalidModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
