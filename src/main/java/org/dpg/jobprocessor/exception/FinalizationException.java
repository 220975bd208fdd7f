package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * A finalization phase failed in a way that must stop the run and put the unit into error.
 */
public class FinalizationException extends Exception {
    @Serial
    private static final long serialVersionUID = -2093341852708163397L;

    public FinalizationException(String message) {
        super(message);
    }

    public FinalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
