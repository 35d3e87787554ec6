package com.edusync.shared.security.exception;

/**
 * 프론트엔드(메신저 봇 등) API Key 검증 실패 시 발생하는 예외
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
