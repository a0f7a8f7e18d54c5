package com.menuzy.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope shared by every endpoint: {@code success}, {@code data}, {@code message}.
 * Null fields are left out of the JSON body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    // Failed call that still carries a body, e.g. a rejected load result.
    public static <T> ApiResponse<T> error(T data, String message) {
        return new ApiResponse<>(false, data, message);
    }
}
