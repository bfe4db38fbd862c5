package com.eyelevel.documentanalysis.exception;

import java.io.Serial;

/**
 * Thrown by queue consumers to make the message visible again for redelivery.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2314570112085527613L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
