package com.edusync.sync.tenant.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * tenant별 연동 및 자동 동기화 상태
 *
 * <pre>
 * 상태               | connectSource | completeAuth  | disconnect(SOURCE) | disconnect(CALENDAR) | setAutoSync
 * -------------------+---------------+---------------+--------------------+----------------------+------------
 * 연동 없음          | source only   | calendar only | no-op              | no-op                | flag + timer
 * source only        | token 교체    | both          | 연동 없음          | no-op                | flag + timer
 * calendar only      | both          | token 교체    | no-op              | 연동 없음            | flag + timer
 * both               | token 교체    | token 교체    | calendar only      | source only          | flag + timer
 * </pre>
 *
 * autoSyncEnabled는 연동 상태와 독립적입니다. 연동이 빠진 상태의 동기화 패스는 해당 오류로 즉시 종료됩니다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TenantSyncState {

    private String tenantId;

    /**
     * 암호화된 Quera session_id
     */
    private String sourceSessionToken;

    private boolean calendarConnected;

    private boolean autoSyncEnabled;

    private Instant lastSyncedAt;

    /**
     * 마지막 패스의 한 줄 요약 (예: "created=1, updated=0, unchanged=3, failed=0")
     */
    private String lastSyncStatus;

    public static TenantSyncState empty(String tenantId) {
        return TenantSyncState.builder().tenantId(tenantId).build();
    }

    @JsonIgnore
    public boolean isSourceConnected() {
        return sourceSessionToken != null && !sourceSessionToken.isBlank();
    }
}
