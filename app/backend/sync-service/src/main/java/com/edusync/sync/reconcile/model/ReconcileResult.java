package com.edusync.sync.reconcile.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * 레코드 하나의 반영 결과
 * FAILED일 때만 failure가 존재합니다.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconcileResult {

    private final SyncOutcome outcome;
    private final String stableId;
    private final String title;
    private final SyncFailure failure;

    public static ReconcileResult created(String stableId, String title) {
        return new ReconcileResult(SyncOutcome.CREATED, stableId, title, null);
    }

    public static ReconcileResult updated(String stableId, String title) {
        return new ReconcileResult(SyncOutcome.UPDATED, stableId, title, null);
    }

    public static ReconcileResult unchanged(String stableId, String title) {
        return new ReconcileResult(SyncOutcome.UNCHANGED, stableId, title, null);
    }

    public static ReconcileResult failed(SyncFailure failure) {
        return new ReconcileResult(SyncOutcome.FAILED, failure.getStableId(), failure.getTitle(), failure);
    }

    public Optional<SyncFailure> failure() {
        return Optional.ofNullable(failure);
    }
}
