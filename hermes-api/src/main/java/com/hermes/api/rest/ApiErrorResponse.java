package com.hermes.api.rest;

/**
 * Error envelope: {@code {"status": "error", "error": {"code": 404, "message": "..."}}}.
 */
public record ApiErrorResponse(
    String status,
    ErrorBody error
) {
    public record ErrorBody(int code, String message) {}

    public static ApiErrorResponse of(int code, String message) {
        return new ApiErrorResponse("error", new ErrorBody(code, message));
    }
}
