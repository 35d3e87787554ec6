package com.edusync.sync.command.service;

import com.edusync.sync.command.dto.AuthorizationUrlResponse;
import com.edusync.sync.command.dto.SyncResultResponse;
import com.edusync.sync.command.dto.TenantStatusResponse;
import com.edusync.sync.credential.service.CalendarAuthService;
import com.edusync.sync.credential.service.CredentialStore;
import com.edusync.sync.source.AssignmentSource;
import com.edusync.sync.source.exception.SourceException;
import com.edusync.sync.source.exception.SourceException.Reason;
import com.edusync.sync.sync.scheduler.AutoSyncScheduler;
import com.edusync.sync.sync.service.SyncOrchestrator;
import com.edusync.sync.tenant.model.ConnectionType;
import com.edusync.sync.tenant.model.TenantSyncState;
import com.edusync.sync.tenant.service.TenantStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 프론트엔드(메신저 봇)가 호출하는 tenant 명령
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantCommandService {

    private final CalendarAuthService calendarAuthService;
    private final CredentialStore credentialStore;
    private final TenantStateService tenantStateService;
    private final AssignmentSource assignmentSource;
    private final SyncOrchestrator syncOrchestrator;
    private final AutoSyncScheduler autoSyncScheduler;

    public AuthorizationUrlResponse startAuth(String tenantId) {
        return AuthorizationUrlResponse.builder()
                .authUrl(calendarAuthService.startAuth(tenantId))
                .build();
    }

    public TenantStatusResponse completeAuth(String tenantId, String code) {
        calendarAuthService.completeAuth(tenantId, code);
        tenantStateService.markCalendarConnected(tenantId, true);
        return getStatus(tenantId);
    }

    /**
     * 포털이 세션을 받아들이는 경우에만 저장합니다.
     */
    public TenantStatusResponse connectSource(String tenantId, String sessionToken) {
        String token = sessionToken.strip();
        if (!assignmentSource.isSessionValid(token)) {
            log.warn("Rejected Quera session on connect: tenantId={}", tenantId);
            throw new SourceException(Reason.SESSION_INVALID, "Quera did not accept the session token");
        }
        tenantStateService.connectSource(tenantId, token);
        log.info("✅ Quera connected: tenantId={}", tenantId);
        return getStatus(tenantId);
    }

    /**
     * 연동만 해제하며 자동 동기화 타이머는 유지합니다.
     */
    public TenantStatusResponse disconnect(String tenantId, ConnectionType connection) {
        switch (connection) {
            case CALENDAR:
                syncOrchestrator.runExclusively(tenantId, () -> {
                    calendarAuthService.cancel(tenantId);
                    credentialStore.delete(tenantId);
                    tenantStateService.markCalendarConnected(tenantId, false);
                });
                break;
            case SOURCE:
                tenantStateService.disconnectSource(tenantId);
                break;
            default:
                throw new IllegalArgumentException("Unsupported connection: " + connection);
        }
        log.info("Disconnected: tenantId={}, connection={}", tenantId, connection);
        return getStatus(tenantId);
    }

    public SyncResultResponse syncNow(String tenantId) {
        return SyncResultResponse.from(syncOrchestrator.runOnce(tenantId));
    }

    public TenantStatusResponse setAutoSync(String tenantId, boolean enabled) {
        if (enabled) {
            autoSyncScheduler.enable(tenantId);
        } else {
            autoSyncScheduler.disable(tenantId);
        }
        log.info("Auto-sync {}: tenantId={}", enabled ? "enabled" : "disabled", tenantId);
        return getStatus(tenantId);
    }

    public TenantStatusResponse getStatus(String tenantId) {
        TenantSyncState state = tenantStateService.get(tenantId);
        return TenantStatusResponse.builder()
                .tenantId(tenantId)
                .calendarConnected(state.isCalendarConnected())
                .sourceConnected(state.isSourceConnected())
                .autoSyncEnabled(state.isAutoSyncEnabled())
                .autoSyncScheduled(autoSyncScheduler.isScheduled(tenantId))
                .syncRunning(syncOrchestrator.isRunning(tenantId))
                .calendarAuthPending(calendarAuthService.hasPendingFlow(tenantId))
                .lastSyncedAt(state.getLastSyncedAt())
                .lastSyncStatus(state.getLastSyncStatus())
                .build();
    }

    /**
     * 타이머, 자격 증명, 상태를 모두 제거합니다.
     * 실행 중인 패스가 있으면 끝난 뒤에 제거합니다.
     */
    public void deleteAccount(String tenantId) {
        autoSyncScheduler.disable(tenantId);
        syncOrchestrator.removeTenant(tenantId, () -> {
            calendarAuthService.cancel(tenantId);
            credentialStore.delete(tenantId);
            tenantStateService.delete(tenantId);
        });
        log.info("✅ Tenant account deleted: tenantId={}", tenantId);
    }
}
