package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * A request could not be turned into a job, e.g. because the target entity is in the wrong state.
 * Reported to the caller as 400 Bad Request.
 */
public class JobProcessorException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 8817406142290671529L;

    public JobProcessorException(String message) {
        super(message);
    }

    public JobProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
