package com.cgi.medscrub.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standard API response wrapper.
 *
 * @param <T> Type of data contained in the response
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {
    private boolean success;
    private T data;

    /**
     * Error message in case of failure. Never contains input text.
     */
    private String error;

    private String errorCode;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, null);
    }

    /**
     * Creates an error response with a message and code.
     *
     * @param errorMessage Error message
     * @param errorCode Error code
     * @param <T> Type of data
     * @return Error API response
     */
    public static <T> ApiResponse<T> error(String errorMessage, String errorCode) {
        return new ApiResponse<>(false, null, errorMessage, errorCode);
    }
}
