package org.dpg.jobprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote resource does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7719345201983746620L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
