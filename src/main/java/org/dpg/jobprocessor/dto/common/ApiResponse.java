package org.dpg.jobprocessor.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope for every response of the job API. A successful job submission carries the new job's id
 * in {@link #response}; an error carries a display message and, optionally, a detail string.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static ApiResponse<Object> error(String displayMessage) {
        return ApiResponse.builder().displayMessage(displayMessage).showMessage(true).build();
    }

    public static ApiResponse<Object> error(String displayMessage, String detail) {
        return ApiResponse.builder().displayMessage(displayMessage).response(detail).showMessage(true).build();
    }
}
