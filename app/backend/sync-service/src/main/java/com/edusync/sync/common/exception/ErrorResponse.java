package com.edusync.sync.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 오류 응답. tenant를 특정할 수 있는 오류에만 tenantId가 포함됩니다.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String errorCode;
    private final String message;
    private final String tenantId;
    private final LocalDateTime timestamp;

    public ErrorResponse(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public ErrorResponse(String errorCode, String message, String tenantId) {
        this.errorCode = errorCode;
        this.message = message;
        this.tenantId = tenantId;
        this.timestamp = LocalDateTime.now();
    }
}
