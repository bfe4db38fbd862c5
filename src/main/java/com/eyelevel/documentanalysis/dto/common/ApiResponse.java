package com.eyelevel.documentanalysis.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses, successful or not.
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

    public static <T> ApiResponse<T> error(final String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    /**
     * Builds an error body whose {@code response} carries a technical detail next to the user-facing message.
     */
    public static ApiResponse<Object> error(final String displayMessage, final Object detail) {
        return ApiResponse.builder().displayMessage(displayMessage).showMessage(true).response(detail).build();
    }
}
