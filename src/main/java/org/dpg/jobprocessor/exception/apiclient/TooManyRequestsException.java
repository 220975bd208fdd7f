package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is rate limiting this client (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5129967410355207441L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
