package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * Metadata could not be published to the discovery system.
 */
public class PublicationException extends Exception {
    @Serial
    private static final long serialVersionUID = -5127744189263087101L;

    public PublicationException(String message) {
        super(message);
    }

    public PublicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
