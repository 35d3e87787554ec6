package com.edusync.sync.deadline.model;

import com.edusync.sync.reconcile.model.SyncFailure;

import java.util.List;

/**
 * 조립 결과: 반영 대상 레코드와 날짜 해석에 실패한 항목
 */
public record AssignmentBatch(List<AssignmentRecord> records, List<SyncFailure> rejected) {

    public boolean isEmpty() {
        return records.isEmpty() && rejected.isEmpty();
    }
}
