package com.edusync.sync.reconcile.model;

/**
 * 레코드 단위 실패 원인
 */
public enum FailureKind {
    /** 마감일 문자열 해석 실패 */
    INVALID_DATE,
    /** URL에서 stableId 추출 실패 */
    MISSING_STABLE_ID,
    /** 기존 일정 조회 실패 */
    REMOTE_QUERY,
    /** 일정 생성/수정 실패 */
    REMOTE_WRITE;

    /**
     * 캘린더 API 호출 중 발생한 실패인지
     */
    public boolean isRemote() {
        return this == REMOTE_QUERY || this == REMOTE_WRITE;
    }
}
