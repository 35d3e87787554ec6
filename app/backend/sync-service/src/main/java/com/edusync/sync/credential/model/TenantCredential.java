package com.edusync.sync.credential.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * tenant의 Google Calendar OAuth 자격 증명
 *
 * 최초 인증 완료 시 생성, 토큰 갱신 시 교체, 사용자가 연동 해제/계정 삭제 시에만 제거됩니다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TenantCredential {

    private String tenantId;

    private String accessToken;

    private String refreshToken;

    /**
     * access token 만료 시각 (null이면 만료 정보 없음)
     */
    private Instant expiry;

    private String scope;

    /**
     * skew 이내에 만료되면 만료된 것으로 봅니다.
     */
    public boolean isExpired(Instant now, Duration skew) {
        if (expiry == null) {
            return false;
        }
        return !now.plus(skew).isBefore(expiry);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }
}
