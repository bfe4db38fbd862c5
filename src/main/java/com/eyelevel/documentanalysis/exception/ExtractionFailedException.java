package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * Thrown when no extraction tier could produce text for a document.
 */
public class ExtractionFailedException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = -6413927183021596675L;

    public ExtractionFailedException(String message) {
        super(message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
