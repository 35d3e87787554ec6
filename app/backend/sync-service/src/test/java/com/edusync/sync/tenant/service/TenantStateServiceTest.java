package com.edusync.sync.tenant.service;

import com.edusync.sync.common.config.EncryptionService;
import com.edusync.sync.common.store.JsonFileStore;
import com.edusync.sync.tenant.model.TenantSyncState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TenantStateService 테스트")
class TenantStateServiceTest {

    private static final String TENANT_ID = "tenant-42";

    @TempDir
    Path tempDir;

    private Path stateFile;
    private ObjectMapper objectMapper;
    private EncryptionService encryptionService;
    private TenantStateService tenantStateService;

    @BeforeEach
    void setUp() throws Exception {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        stateFile = tempDir.resolve("user_data.json");
        encryptionService = new EncryptionService(EncryptionService.generateKey());
        tenantStateService = newService();
    }

    @Test
    @DisplayName("저장된 상태가 없으면 빈 상태 반환")
    void get_Default() {
        TenantSyncState state = tenantStateService.get(TENANT_ID);

        assertThat(state.getTenantId()).isEqualTo(TENANT_ID);
        assertThat(state.isCalendarConnected()).isFalse();
        assertThat(state.isSourceConnected()).isFalse();
        assertThat(state.isAutoSyncEnabled()).isFalse();
        assertThat(tenantStateService.find(TENANT_ID)).isEmpty();
    }

    @Test
    @DisplayName("Quera 세션은 암호화 저장, 조회 시 복호화")
    void connectSource_Encrypted() throws Exception {
        // When
        tenantStateService.connectSource(TENANT_ID, "plain-session-id");

        // Then
        assertThat(tenantStateService.findSourceSessionToken(TENANT_ID)).contains("plain-session-id");
        assertThat(tenantStateService.get(TENANT_ID).getSourceSessionToken()).isNotEqualTo("plain-session-id");
        assertThat(Files.readString(stateFile)).doesNotContain("plain-session-id");
    }

    @Test
    @DisplayName("Quera 연동 해제 후 세션 없음, 다른 필드는 유지")
    void disconnectSource() {
        // Given
        tenantStateService.connectSource(TENANT_ID, "session");
        tenantStateService.markCalendarConnected(TENANT_ID, true);

        // When
        tenantStateService.disconnectSource(TENANT_ID);

        // Then
        assertThat(tenantStateService.findSourceSessionToken(TENANT_ID)).isEmpty();
        assertThat(tenantStateService.get(TENANT_ID).isCalendarConnected()).isTrue();
    }

    @Test
    @DisplayName("동기화 결과와 플래그는 재시작 후에도 유지")
    void persistAcrossRestart() {
        // Given
        Instant syncedAt = Instant.parse("2024-05-01T08:30:00Z");
        tenantStateService.setAutoSyncEnabled(TENANT_ID, true);
        tenantStateService.recordSync(TENANT_ID, syncedAt, "created=1, updated=0, unchanged=0, failed=0");

        // When
        TenantSyncState reloaded = newService().get(TENANT_ID);

        // Then
        assertThat(reloaded.isAutoSyncEnabled()).isTrue();
        assertThat(reloaded.getLastSyncedAt()).isEqualTo(syncedAt);
        assertThat(reloaded.getLastSyncStatus()).isEqualTo("created=1, updated=0, unchanged=0, failed=0");
    }

    @Test
    @DisplayName("autoSyncEnabled인 tenant만 복원 대상")
    void findAutoSyncEnabledTenantIds() {
        tenantStateService.setAutoSyncEnabled("tenant-a", true);
        tenantStateService.setAutoSyncEnabled("tenant-b", false);
        tenantStateService.setAutoSyncEnabled("tenant-c", true);

        assertThat(tenantStateService.findAutoSyncEnabledTenantIds())
                .containsExactlyInAnyOrder("tenant-a", "tenant-c");
    }

    @Test
    @DisplayName("같은 tenant의 동시 변경이 유실되지 않음")
    void update_Concurrent() {
        // Given
        tenantStateService.markCalendarConnected(TENANT_ID, false);
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        // When
        futures.add(CompletableFuture.runAsync(() -> tenantStateService.connectSource(TENANT_ID, "session")));
        futures.add(CompletableFuture.runAsync(() -> tenantStateService.markCalendarConnected(TENANT_ID, true)));
        futures.add(CompletableFuture.runAsync(() -> tenantStateService.setAutoSyncEnabled(TENANT_ID, true)));
        futures.add(CompletableFuture.runAsync(() ->
                tenantStateService.recordSync(TENANT_ID, Instant.EPOCH, "created=0, updated=0, unchanged=0, failed=0")));
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // Then
        TenantSyncState state = tenantStateService.get(TENANT_ID);
        assertThat(state.isSourceConnected()).isTrue();
        assertThat(state.isCalendarConnected()).isTrue();
        assertThat(state.isAutoSyncEnabled()).isTrue();
        assertThat(state.getLastSyncedAt()).isEqualTo(Instant.EPOCH);
    }

    @Test
    @DisplayName("저장된 상태가 없으면 updateIfPresent와 recordSync는 아무것도 만들지 않음")
    void updateIfPresent_Missing() {
        // When
        Optional<TenantSyncState> updated = tenantStateService.updateIfPresent(TENANT_ID,
                state -> state.toBuilder().calendarConnected(true).build());
        Optional<TenantSyncState> recorded = tenantStateService.recordSync(TENANT_ID, Instant.EPOCH,
                "created=0, updated=0, unchanged=0, failed=0");

        // Then
        assertThat(updated).isEmpty();
        assertThat(recorded).isEmpty();
        assertThat(tenantStateService.find(TENANT_ID)).isEmpty();
    }

    @Test
    @DisplayName("저장된 상태가 있으면 updateIfPresent로 변경")
    void updateIfPresent_Existing() {
        // Given
        tenantStateService.markCalendarConnected(TENANT_ID, true);

        // When
        Optional<TenantSyncState> updated = tenantStateService.updateIfPresent(TENANT_ID,
                state -> state.toBuilder().calendarConnected(false).build());

        // Then
        assertThat(updated).isPresent();
        assertThat(tenantStateService.get(TENANT_ID).isCalendarConnected()).isFalse();
    }

    @Test
    @DisplayName("삭제 후 기본 상태")
    void delete() {
        tenantStateService.setAutoSyncEnabled(TENANT_ID, true);

        tenantStateService.delete(TENANT_ID);

        assertThat(tenantStateService.find(TENANT_ID)).isEmpty();
        assertThat(tenantStateService.findAutoSyncEnabledTenantIds()).isEmpty();
    }

    private TenantStateService newService() {
        return new TenantStateService(new JsonFileStore<>(stateFile, objectMapper, TenantSyncState.class),
                encryptionService);
    }
}
