package com.menuzy.common.exception;

import lombok.Getter;

/**
 * Unchecked exception for domain rule violations, carrying the {@link ErrorCode}
 * that decides the HTTP status and default message.
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.INVALID_INPUT, "timeout_seconds must be positive");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
