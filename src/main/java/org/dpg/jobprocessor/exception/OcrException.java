package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * An OCR request was rejected, reported failure through its callback, or never called back.
 */
public class OcrException extends Exception {
    @Serial
    private static final long serialVersionUID = 4410982215667301904L;

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
