package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * Thrown when no run exists for the requested user and run identifier.
 */
public class RunNotFoundException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = -2210837740517363817L;

    public RunNotFoundException(String message) {
        super(message);
    }

    public RunNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
