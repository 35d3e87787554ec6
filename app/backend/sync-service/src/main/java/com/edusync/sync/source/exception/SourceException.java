package com.edusync.sync.source.exception;

import lombok.Getter;

/**
 * 과제 포털 조회 실패 (동기화 패스 전체 중단)
 */
@Getter
public class SourceException extends RuntimeException {

    public enum Reason {
        /** 저장된 세션 없음 */
        NOT_CONNECTED,
        /** 세션 만료 또는 로그인 페이지로 리다이렉트 */
        SESSION_INVALID,
        /** 네트워크 오류, 타임아웃, 5xx */
        UNAVAILABLE
    }

    private final Reason reason;

    public SourceException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SourceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
