package com.dcaswap.api.dto;

/**
 * Success envelope: {data, success: true}.
 */
public record ApiResponse<T>(T data, boolean success) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(data, true);
    }
}
