package com.menuzy.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // User
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),

    // Restaurant
    RESTAURANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Restaurant not found"),
    CATEGORY_NOT_FOUND(HttpStatus.NOT_FOUND, "Category not found");

    private final HttpStatus status;
    private final String message;
}
