package com.edusync.sync.credential.exception;

import lombok.Getter;

/**
 * Google 토큰 엔드포인트 호출 실패
 */
@Getter
public class OAuthTokenException extends RuntimeException {

    /**
     * true: Google이 grant를 거부함 (invalid_grant 등, 재인증 필요)
     * false: 네트워크 오류나 5xx 등 일시적 실패
     */
    private final boolean rejected;

    public OAuthTokenException(String message, boolean rejected) {
        super(message);
        this.rejected = rejected;
    }

    public OAuthTokenException(String message, boolean rejected, Throwable cause) {
        super(message, cause);
        this.rejected = rejected;
    }
}
