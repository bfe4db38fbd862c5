package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * Thrown when a run identifier is reused for the same user.
 */
public class RunAlreadyExistsException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = 7130488310364958110L;

    public RunAlreadyExistsException(String message) {
        super(message);
    }

    public RunAlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
