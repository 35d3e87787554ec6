package com.edusync.sync.reconcile.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 동기화 패스 한 번의 결과 집계
 * 저장되지 않으며 lastSyncStatus 한 줄 요약만 남습니다.
 */
@Getter
@ToString
public class SyncBatchResult {

    private final int created;
    private final int updated;
    private final int unchanged;
    private final int failed;
    private final List<SyncFailure> failures;

    private SyncBatchResult(int created, int updated, int unchanged, List<SyncFailure> failures) {
        this.created = created;
        this.updated = updated;
        this.unchanged = unchanged;
        this.failed = failures.size();
        this.failures = Collections.unmodifiableList(failures);
    }

    public static SyncBatchResult empty() {
        return new SyncBatchResult(0, 0, 0, new ArrayList<>());
    }

    public static SyncBatchResult from(List<ReconcileResult> results) {
        int created = 0;
        int updated = 0;
        int unchanged = 0;
        List<SyncFailure> failures = new ArrayList<>();

        for (ReconcileResult result : results) {
            switch (result.getOutcome()) {
                case CREATED:
                    created++;
                    break;
                case UPDATED:
                    updated++;
                    break;
                case UNCHANGED:
                    unchanged++;
                    break;
                case FAILED:
                    failures.add(result.getFailure());
                    break;
                default:
                    break;
            }
        }
        return new SyncBatchResult(created, updated, unchanged, failures);
    }

    /**
     * 조립 단계에서 거부된 레코드를 실패 목록 앞쪽에 합칩니다.
     */
    public SyncBatchResult withRejected(List<SyncFailure> rejected) {
        if (rejected.isEmpty()) {
            return this;
        }
        List<SyncFailure> merged = new ArrayList<>(rejected);
        merged.addAll(failures);
        return new SyncBatchResult(created, updated, unchanged, merged);
    }

    public int getTotal() {
        return created + updated + unchanged + failed;
    }

    public int getSucceeded() {
        return created + updated + unchanged;
    }

    /**
     * 성공한 레코드 없이 캘린더 호출이 모두 401/403으로 거부되었는지
     * 조립 단계 거부(INVALID_DATE 등)는 판단에서 제외합니다.
     */
    public boolean isCalendarAuthorizationLost() {
        if (getSucceeded() > 0) {
            return false;
        }
        List<SyncFailure> remoteFailures = failures.stream()
                .filter(failure -> failure.getKind() != null && failure.getKind().isRemote())
                .toList();
        return !remoteFailures.isEmpty()
                && remoteFailures.stream().allMatch(SyncFailure::isAuthorizationRequired);
    }

    /**
     * lastSyncStatus로 저장되는 한 줄 요약
     */
    public String summary() {
        return String.format("created=%d, updated=%d, unchanged=%d, failed=%d",
                created, updated, unchanged, failed);
    }
}
