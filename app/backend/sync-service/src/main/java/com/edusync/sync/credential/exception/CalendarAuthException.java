package com.edusync.sync.credential.exception;

import lombok.Getter;

/**
 * 캘린더 자격 증명을 사용할 수 없어 동기화 패스 전체가 중단되는 경우
 */
@Getter
public class CalendarAuthException extends RuntimeException {

    public enum Reason {
        /** 저장된 자격 증명 없음 */
        NOT_CONNECTED,
        /** 갱신 불가 (refresh token 없음 또는 Google이 거부) */
        REFRESH_REJECTED,
        /** 갱신 중 네트워크/서버 오류 */
        REFRESH_FAILED
    }

    private final String tenantId;
    private final Reason reason;

    public CalendarAuthException(String tenantId, Reason reason, String message) {
        super(message);
        this.tenantId = tenantId;
        this.reason = reason;
    }

    public CalendarAuthException(String tenantId, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
        this.reason = reason;
    }
}
