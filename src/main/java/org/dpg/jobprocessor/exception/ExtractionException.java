package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * Image metadata could not be read, or what was read is unusable (zero dimensions, CMYK, no headline).
 */
public class ExtractionException extends Exception {
    @Serial
    private static final long serialVersionUID = -846250716305561122L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
