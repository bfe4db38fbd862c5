package com.eyelevel.documentanalysis.exception;

import com.eyelevel.documentanalysis.model.RunStatus;
import lombok.Getter;

import java.io.Serial;

/**
 * Thrown by the client-side poller when a run has not reached a terminal state within the allowed wait.
 * The run itself is unaffected and keeps progressing on the server.
 */
@Getter
public class PollingTimeoutException extends DocumentAnalysisException {
    @Serial
    private static final long serialVersionUID = -829371640937105466L;

    private final RunStatus lastObservedStatus;

    public PollingTimeoutException(String message, RunStatus lastObservedStatus) {
        super(message);
        this.lastObservedStatus = lastObservedStatus;
    }
}
