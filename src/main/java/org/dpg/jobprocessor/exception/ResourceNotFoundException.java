package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * A job, unit, order or metadata record named in a request does not exist.
 */
public class ResourceNotFoundException extends JobProcessorException {
    @Serial
    private static final long serialVersionUID = -5470331208726418035L;

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
