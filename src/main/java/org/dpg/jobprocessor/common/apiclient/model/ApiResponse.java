package org.dpg.jobprocessor.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Raw 2xx answer of an external service. Clients parse {@link #data} into their own DTOs.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * Response body; an empty array when the service sent none.
     */
    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType acceptType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;
}
