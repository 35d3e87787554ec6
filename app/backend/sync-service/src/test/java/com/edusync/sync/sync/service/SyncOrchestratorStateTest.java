package com.edusync.sync.sync.service;

import com.edusync.sync.common.config.EncryptionService;
import com.edusync.sync.common.store.JsonFileStore;
import com.edusync.sync.credential.model.TenantCredential;
import com.edusync.sync.credential.service.CredentialStore;
import com.edusync.sync.deadline.model.AssignmentBatch;
import com.edusync.sync.deadline.model.AssignmentRecord;
import com.edusync.sync.deadline.model.RawAssignment;
import com.edusync.sync.deadline.service.AssignmentRecordAssembler;
import com.edusync.sync.reconcile.model.FailureKind;
import com.edusync.sync.reconcile.model.ReconcileResult;
import com.edusync.sync.reconcile.model.SyncBatchResult;
import com.edusync.sync.reconcile.model.SyncFailure;
import com.edusync.sync.reconcile.service.DeadlineReconciler;
import com.edusync.sync.source.AssignmentSource;
import com.edusync.sync.source.exception.SourceException;
import com.edusync.sync.tenant.model.TenantSyncState;
import com.edusync.sync.tenant.service.TenantStateService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

/**
 * 실제 상태 저장소를 사용하는 SyncOrchestrator 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SyncOrchestrator 상태 저장 테스트")
class SyncOrchestratorStateTest {

    private static final String TENANT_ID = "tenant-42";
    private static final String SESSION = "quera-session";
    private static final Instant NOW = Instant.parse("2024-05-01T08:30:00Z");

    @TempDir
    Path tempDir;

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private AssignmentSource assignmentSource;

    @Mock
    private AssignmentRecordAssembler recordAssembler;

    @Mock
    private DeadlineReconciler reconciler;

    private TenantStateService tenantStateService;
    private SyncOrchestrator syncOrchestrator;
    private TenantCredential credential;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        tenantStateService = new TenantStateService(
                new JsonFileStore<>(tempDir.resolve("user_data.json"), objectMapper, TenantSyncState.class),
                new EncryptionService(EncryptionService.generateKey()));
        syncOrchestrator = new SyncOrchestrator(tenantStateService, credentialStore, assignmentSource,
                recordAssembler, reconciler, Clock.fixed(NOW, ZoneOffset.UTC));
        credential = TenantCredential.builder().tenantId(TENANT_ID).accessToken("access-token").build();

        tenantStateService.connectSource(TENANT_ID, SESSION);
        tenantStateService.markCalendarConnected(TENANT_ID, true);
    }

    @Test
    @DisplayName("패스 도중 삭제된 tenant는 결과 기록으로 되살아나지 않음")
    void runOnce_TenantDeletedDuringPass() {
        // Given
        given(credentialStore.ensureFresh(TENANT_ID)).willReturn(credential);
        given(assignmentSource.fetchAssignments(SESSION)).willAnswer(invocation -> {
            tenantStateService.delete(TENANT_ID);
            return List.of();
        });
        given(recordAssembler.assemble(List.of(), NOW)).willReturn(new AssignmentBatch(List.of(), List.of()));

        // When
        SyncBatchResult result = syncOrchestrator.runOnce(TENANT_ID);

        // Then
        assertThat(result.getTotal()).isZero();
        assertThat(tenantStateService.find(TENANT_ID)).isEmpty();
    }

    @Test
    @DisplayName("패스 도중 삭제된 tenant는 오류 기록으로도 되살아나지 않음")
    void runOnce_TenantDeletedBeforeSourceError() {
        // Given
        given(credentialStore.ensureFresh(TENANT_ID)).willReturn(credential);
        given(assignmentSource.fetchAssignments(SESSION)).willAnswer(invocation -> {
            tenantStateService.delete(TENANT_ID);
            throw new SourceException(SourceException.Reason.UNAVAILABLE, "down");
        });

        // When & Then
        assertThatThrownBy(() -> syncOrchestrator.runOnce(TENANT_ID))
                .isInstanceOf(SourceException.class);
        assertThat(tenantStateService.find(TENANT_ID)).isEmpty();
    }

    @Test
    @DisplayName("캘린더가 모든 요청을 거부하면 연동 해제 상태와 요약이 저장됨")
    void runOnce_CalendarRejectsEveryRequest() {
        // Given
        List<RawAssignment> raw = List.of(RawAssignment.builder().title("HW1").build());
        List<AssignmentRecord> records = List.of(AssignmentRecord.builder().title("HW1 | Algorithms").build());
        SyncFailure unauthorized = SyncFailure.builder()
                .stableId("85830")
                .title("HW1 | Algorithms")
                .kind(FailureKind.REMOTE_WRITE)
                .reason("401 Unauthorized")
                .authorizationRequired(true)
                .build();

        given(credentialStore.ensureFresh(TENANT_ID)).willReturn(credential);
        given(assignmentSource.fetchAssignments(SESSION)).willReturn(raw);
        given(recordAssembler.assemble(raw, NOW)).willReturn(new AssignmentBatch(records, List.of()));
        given(reconciler.reconcileBatch(credential, records))
                .willReturn(SyncBatchResult.from(List.of(ReconcileResult.failed(unauthorized))));

        // When
        syncOrchestrator.runOnce(TENANT_ID);

        // Then
        TenantSyncState state = tenantStateService.get(TENANT_ID);
        assertThat(state.isCalendarConnected()).isFalse();
        assertThat(state.isSourceConnected()).isTrue();
        assertThat(state.getLastSyncedAt()).isEqualTo(NOW);
        assertThat(state.getLastSyncStatus()).isEqualTo("created=0, updated=0, unchanged=0, failed=1");
    }
}
