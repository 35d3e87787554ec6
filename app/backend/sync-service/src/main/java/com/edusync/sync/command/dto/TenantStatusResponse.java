package com.edusync.sync.command.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "tenant 연동 상태")
public class TenantStatusResponse {

    private String tenantId;

    private boolean calendarConnected;

    private boolean sourceConnected;

    private boolean autoSyncEnabled;

    @Schema(description = "자동 동기화 타이머 동작 여부")
    private boolean autoSyncScheduled;

    @Schema(description = "동기화 패스 실행 중 여부")
    private boolean syncRunning;

    @Schema(description = "Google 인증 URL을 발급받고 code 입력을 기다리는 중")
    private boolean calendarAuthPending;

    private Instant lastSyncedAt;

    @Schema(description = "마지막 동기화 요약", example = "created=1, updated=0, unchanged=3, failed=0")
    private String lastSyncStatus;
}
