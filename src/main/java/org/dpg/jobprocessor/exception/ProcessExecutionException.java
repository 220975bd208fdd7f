package org.dpg.jobprocessor.exception;

import java.io.Serial;

/**
 * An external command (exiftool, magick) exited with a non-zero code.
 */
public class ProcessExecutionException extends Exception {
    @Serial
    private static final long serialVersionUID = 1502874439027351146L;

    public ProcessExecutionException(String message) {
        super(message);
    }
}
