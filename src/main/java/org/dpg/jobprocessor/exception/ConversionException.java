package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * A metadata record could not be linked to its ArchivesSpace object.
 */
public class ConversionException extends Exception {
    @Serial
    private static final long serialVersionUID = 4400913826675025196L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
