package org.dpg.jobprocessor.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for failures reported by one of the external services the processor talks to
 * (OCR, reindex, IIIF manifest, project tracker, preservation registry, ArchivesSpace, catalog).
 * Carries the HTTP status the remote side answered with, or the closest status for transport errors.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 2218455360915436012L;
    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
