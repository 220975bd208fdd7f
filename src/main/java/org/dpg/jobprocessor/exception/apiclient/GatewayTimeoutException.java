package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The call did not complete within the client timeout (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6041223357981126735L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
