package com.edusync.sync.sync.service;

import com.edusync.sync.credential.exception.CalendarAuthException;
import com.edusync.sync.credential.model.TenantCredential;
import com.edusync.sync.credential.service.CredentialStore;
import com.edusync.sync.deadline.model.AssignmentBatch;
import com.edusync.sync.deadline.model.RawAssignment;
import com.edusync.sync.deadline.service.AssignmentRecordAssembler;
import com.edusync.sync.reconcile.model.SyncBatchResult;
import com.edusync.sync.reconcile.service.DeadlineReconciler;
import com.edusync.sync.source.AssignmentSource;
import com.edusync.sync.source.exception.SourceException;
import com.edusync.sync.source.exception.SourceException.Reason;
import com.edusync.sync.sync.exception.SyncInProgressException;
import com.edusync.sync.tenant.service.TenantStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * tenant 하나에 대한 동기화 패스
 *
 * Quera 세션 확인 → 캘린더 자격 증명 갱신 → 과제 조회 → 레코드 조립 → 캘린더 반영 → 결과 기록
 * tenant당 동시에 하나의 패스만 실행됩니다 (수동/자동 공통).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncOrchestrator {

    private final TenantStateService tenantStateService;
    private final CredentialStore credentialStore;
    private final AssignmentSource assignmentSource;
    private final AssignmentRecordAssembler recordAssembler;
    private final DeadlineReconciler reconciler;
    private final Clock clock;

    private final Map<String, ReentrantLock> passLocks = new ConcurrentHashMap<>();

    /**
     * @throws SyncInProgressException 같은 tenant의 패스가 이미 실행 중
     * @throws SourceException         Quera 미연동, 세션 만료, 접속 불가 (캘린더 호출 없음)
     * @throws CalendarAuthException   캘린더 미연동 또는 토큰 갱신 실패
     */
    public SyncBatchResult runOnce(String tenantId) {
        ReentrantLock lock = passLocks.computeIfAbsent(tenantId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.info("Sync pass skipped, another pass is running: tenantId={}", tenantId);
            throw new SyncInProgressException(tenantId);
        }
        try {
            return execute(tenantId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(String tenantId) {
        ReentrantLock lock = passLocks.get(tenantId);
        return lock != null && lock.isLocked();
    }

    /**
     * 실행 중인 패스가 끝날 때까지 기다린 뒤 action을 수행합니다.
     * 수행 중에는 같은 tenant의 새 패스가 SyncInProgress로 거부됩니다.
     */
    public void runExclusively(String tenantId, Runnable action) {
        ReentrantLock lock = passLocks.computeIfAbsent(tenantId, id -> new ReentrantLock());
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * runExclusively와 같으며, 정리 후 tenant의 락을 제거합니다.
     */
    public void removeTenant(String tenantId, Runnable cleanup) {
        ReentrantLock lock = passLocks.computeIfAbsent(tenantId, id -> new ReentrantLock());
        lock.lock();
        try {
            cleanup.run();
        } finally {
            passLocks.remove(tenantId, lock);
            lock.unlock();
        }
        log.info("Removed tenant from sync: tenantId={}", tenantId);
    }

    int trackedTenantCount() {
        return passLocks.size();
    }

    private SyncBatchResult execute(String tenantId) {
        log.info("Starting sync pass: tenantId={}", tenantId);

        String sessionToken = tenantStateService.findSourceSessionToken(tenantId)
                .orElseThrow(() -> new SourceException(Reason.NOT_CONNECTED, "Quera is not connected"));

        TenantCredential credential;
        try {
            credential = credentialStore.ensureFresh(tenantId);
        } catch (CalendarAuthException e) {
            tenantStateService.updateIfPresent(tenantId, state -> state.toBuilder()
                    .calendarConnected(false)
                    .lastSyncStatus("error: calendar " + e.getReason())
                    .build());
            log.warn("Sync pass aborted, calendar authorization required: tenantId={}, reason={}",
                    tenantId, e.getReason());
            throw e;
        }

        List<RawAssignment> rawAssignments;
        try {
            rawAssignments = assignmentSource.fetchAssignments(sessionToken);
        } catch (SourceException e) {
            tenantStateService.updateIfPresent(tenantId, state -> state.toBuilder()
                    .lastSyncStatus("error: source " + e.getReason())
                    .build());
            log.warn("Sync pass aborted, source unavailable: tenantId={}, reason={}", tenantId, e.getReason());
            throw e;
        }

        Instant now = clock.instant();
        AssignmentBatch batch = recordAssembler.assemble(rawAssignments, now);

        SyncBatchResult result;
        if (batch.records().isEmpty()) {
            log.info("No assignments to reconcile: tenantId={}, rejected={}", tenantId, batch.rejected().size());
            result = SyncBatchResult.empty().withRejected(batch.rejected());
        } else {
            result = reconciler.reconcileBatch(credential, batch.records()).withRejected(batch.rejected());
        }

        if (result.isCalendarAuthorizationLost()) {
            tenantStateService.updateIfPresent(tenantId, state -> state.toBuilder().calendarConnected(false).build());
            log.warn("Calendar rejected every request, reconnection required: tenantId={}, failed={}",
                    tenantId, result.getFailed());
        }

        tenantStateService.recordSync(tenantId, now, result.summary());
        log.info("✅ Sync pass completed: tenantId={}, {}", tenantId, result.summary());
        return result;
    }
}
