package com.bugbounty.api.error;

/**
 * Uniform error envelope for every failed request.
 *
 * @param status  HTTP status code
 * @param error   human readable message, never an internal exception message for 500s
 * @param details optional structured details, null unless supplied
 */
public record ErrorResponse(
        int status,
        String error,
        Object details
) {

    public static ErrorResponse of(int status, String error) {
        return new ErrorResponse(status, error, null);
    }
}
