package org.dpg.jobprocessor.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * One call to an external service, relative to the base URL of the client's {@code WebClient}.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path template, e.g. {@code projects/{projectId}/done}; placeholders are filled from
     * {@link #pathVariables}.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Mutable so that the client's {@code Authentication} can add its headers before the call.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * Serialized according to {@link #contentType}; a {@code MultiValueMap} is sent as a form.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
