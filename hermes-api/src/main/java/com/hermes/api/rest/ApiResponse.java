package com.hermes.api.rest;

/**
 * Response envelope: {@code {"status": "ok", "data": ...}}.
 */
public record ApiResponse<T>(
    String status,
    T data
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>("ok", data);
    }
}
