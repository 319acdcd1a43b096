package com.rgp.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response envelope for all API endpoints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        Object data,
        String kind,
        List<String> errors
) {
    public static ApiResponse success(String message, Object data) {
        return new ApiResponse("success", message, data, null, null);
    }

    public static ApiResponse error(String kind, String message, List<String> errors) {
        return new ApiResponse("error", message, null, kind, errors);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null, null, null);
    }
}
