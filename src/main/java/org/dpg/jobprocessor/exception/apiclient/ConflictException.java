package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote resource is in a conflicting state (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = -884301562203947113L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
