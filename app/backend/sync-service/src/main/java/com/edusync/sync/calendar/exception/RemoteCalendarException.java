package com.edusync.sync.calendar.exception;

import lombok.Getter;

/**
 * 캘린더 API 호출 실패
 */
@Getter
public class RemoteCalendarException extends RuntimeException {

    /**
     * HTTP 상태 코드 (전송 오류/타임아웃이면 0)
     */
    private final int statusCode;

    public RemoteCalendarException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public RemoteCalendarException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * 401/403: 재시도해도 성공하지 않음
     */
    public boolean isAuthorizationError() {
        return statusCode == 401 || statusCode == 403;
    }

    /**
     * 전송 오류, 429, 5xx
     */
    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 429 || statusCode >= 500;
    }
}
