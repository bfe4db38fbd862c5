package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * A base exception for errors raised while orchestrating a document run.
 */
public class DocumentAnalysisException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234309L;

    public DocumentAnalysisException(String message) {
        super(message);
    }

    public DocumentAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
