package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The credentials are valid but lack permission (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2450918302746419807L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
