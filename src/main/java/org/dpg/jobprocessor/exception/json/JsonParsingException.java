package org.dpg.jobprocessor.exception.json;

import java.io.Serial;

/**
 * Thrown when a JSON payload from an external service or a command-line tool cannot be parsed.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1726091384451260883L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
