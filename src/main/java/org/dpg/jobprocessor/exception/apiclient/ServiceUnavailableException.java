package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service could not be reached or is unavailable (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7301659288432019876L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
