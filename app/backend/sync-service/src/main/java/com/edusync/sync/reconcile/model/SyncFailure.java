package com.edusync.sync.reconcile.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 반영에 실패한 레코드와 사유
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncFailure {

    /**
     * 추출 실패 시 null
     */
    private String stableId;

    private String title;

    private FailureKind kind;

    private String reason;

    /**
     * 다음 패스에서 재시도하면 성공할 수 있는 실패인지 (5xx, 429, 타임아웃)
     */
    private boolean retryable;

    /**
     * 캘린더가 401/403으로 거부함. 재시도 대신 재연동이 필요합니다.
     */
    private boolean authorizationRequired;

    public static SyncFailure of(String stableId, String title, FailureKind kind, String reason) {
        return new SyncFailure(stableId, title, kind, reason, false, false);
    }
}
