package com.edusync.sync.tenant.service;

import com.edusync.sync.common.config.EncryptionService;
import com.edusync.sync.common.store.KeyValueStore;
import com.edusync.sync.tenant.model.TenantSyncState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * tenant 상태 조회/변경
 *
 * 변경은 "읽기 → 수정 → 저장"이 하나의 락 안에서 수행되어 동시 변경이 유실되지 않습니다.
 * Quera 세션 토큰은 암호화하여 저장합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantStateService {

    private final KeyValueStore<TenantSyncState> tenantStateFileStore;
    private final EncryptionService encryptionService;

    private final ReentrantLock updateLock = new ReentrantLock();

    public Optional<TenantSyncState> find(String tenantId) {
        return tenantStateFileStore.get(tenantId);
    }

    public TenantSyncState get(String tenantId) {
        return find(tenantId).orElseGet(() -> TenantSyncState.empty(tenantId));
    }

    public TenantSyncState update(String tenantId, UnaryOperator<TenantSyncState> modifier) {
        updateLock.lock();
        try {
            TenantSyncState updated = modifier.apply(get(tenantId));
            tenantStateFileStore.put(tenantId, updated);
            return updated;
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * 저장된 상태가 있을 때만 변경합니다. 삭제된 tenant는 다시 만들지 않습니다.
     */
    public Optional<TenantSyncState> updateIfPresent(String tenantId, UnaryOperator<TenantSyncState> modifier) {
        updateLock.lock();
        try {
            Optional<TenantSyncState> updated = find(tenantId).map(modifier);
            updated.ifPresentOrElse(
                    state -> tenantStateFileStore.put(tenantId, state),
                    () -> log.info("Skipped update for missing tenant: tenantId={}", tenantId));
            return updated;
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * 복호화된 Quera 세션 토큰
     */
    public Optional<String> findSourceSessionToken(String tenantId) {
        return find(tenantId)
                .filter(TenantSyncState::isSourceConnected)
                .map(state -> encryptionService.decrypt(state.getSourceSessionToken()));
    }

    public TenantSyncState connectSource(String tenantId, String sessionToken) {
        String encrypted = encryptionService.encrypt(sessionToken);
        return update(tenantId, state -> state.toBuilder().sourceSessionToken(encrypted).build());
    }

    public TenantSyncState disconnectSource(String tenantId) {
        return update(tenantId, state -> state.toBuilder().sourceSessionToken(null).build());
    }

    public TenantSyncState markCalendarConnected(String tenantId, boolean connected) {
        return update(tenantId, state -> state.toBuilder().calendarConnected(connected).build());
    }

    public TenantSyncState setAutoSyncEnabled(String tenantId, boolean enabled) {
        return update(tenantId, state -> state.toBuilder().autoSyncEnabled(enabled).build());
    }

    public Optional<TenantSyncState> recordSync(String tenantId, Instant syncedAt, String status) {
        return updateIfPresent(tenantId, state -> state.toBuilder()
                .lastSyncedAt(syncedAt)
                .lastSyncStatus(status)
                .build());
    }

    public void delete(String tenantId) {
        updateLock.lock();
        try {
            tenantStateFileStore.remove(tenantId);
        } finally {
            updateLock.unlock();
        }
        log.info("Deleted tenant state: tenantId={}", tenantId);
    }

    /**
     * 재시작 시 타이머 복원 대상
     */
    public List<String> findAutoSyncEnabledTenantIds() {
        return tenantStateFileStore.findAll().entrySet().stream()
                .filter(entry -> entry.getValue().isAutoSyncEnabled())
                .map(Map.Entry::getKey)
                .toList();
    }
}
