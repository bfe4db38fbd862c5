package com.eyelevel.documentanalysis.exception;

import com.eyelevel.documentanalysis.model.RunStatus;
import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a conditional run update loses against the stored state: the status no longer matches the
 * caller's expectation, another writer committed first, or the requested transition is not allowed.
 */
@Getter
public class StatusConflictException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = -5709728403403396931L;

    /**
     * The stored status observed when the conflict was detected. May be null when unknown.
     */
    private final RunStatus currentStatus;

    public StatusConflictException(String message, RunStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public StatusConflictException(String message, RunStatus currentStatus, Throwable cause) {
        super(message, cause);
        this.currentStatus = currentStatus;
    }
}
