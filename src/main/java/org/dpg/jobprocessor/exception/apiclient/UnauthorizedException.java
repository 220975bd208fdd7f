package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service did not accept the credentials (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3301857725401295581L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
