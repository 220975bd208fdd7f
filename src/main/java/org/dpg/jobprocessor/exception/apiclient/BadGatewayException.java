package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * An upstream of the remote service failed (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 1467720955310874882L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
