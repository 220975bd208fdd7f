package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * A unit failed the finalization preconditions; no job was created.
 */
public class FinalizationRejectedException extends JobProcessorException {
    @Serial
    private static final long serialVersionUID = 3946021877130518462L;

    public FinalizationRejectedException(String message) {
        super(message);
    }
}
