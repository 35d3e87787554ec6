package com.edusync.sync.command.controller;

import com.edusync.shared.security.ServiceAuthValidator;
import com.edusync.sync.command.dto.AuthorizationUrlResponse;
import com.edusync.sync.command.dto.AutoSyncRequest;
import com.edusync.sync.command.dto.CompleteAuthRequest;
import com.edusync.sync.command.dto.ConnectSourceRequest;
import com.edusync.sync.command.dto.SyncResultResponse;
import com.edusync.sync.command.dto.TenantStatusResponse;
import com.edusync.sync.command.service.TenantCommandService;
import com.edusync.sync.tenant.model.ConnectionType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * tenant 명령 API
 * 메신저 봇 등 프론트엔드가 호출합니다.
 *
 * 인증: X-Api-Key 헤더 (ServiceAuthValidator)
 * 경로: /v1/tenants/{tenantId}/**
 */
@Slf4j
@RestController
@RequestMapping("/v1/tenants/{tenantId}")
@RequiredArgsConstructor
@Tag(name = "Tenant Commands", description = "Quera/Google Calendar 연동 및 동기화 API (X-Api-Key 인증)")
public class TenantCommandController {

    private final TenantCommandService tenantCommandService;
    private final ServiceAuthValidator serviceAuthValidator;

    @PostMapping("/calendar/authorization")
    @Operation(summary = "Google Calendar 인증 시작", description = "인증 URL을 발급합니다. 이전에 시작한 흐름은 대체됩니다.")
    public ResponseEntity<AuthorizationUrlResponse> startAuth(
            @PathVariable String tenantId,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey
    ) {
        authenticate(apiKey, "POST /calendar/authorization", tenantId);
        return ResponseEntity.ok(tenantCommandService.startAuth(tenantId));
    }

    @PostMapping("/calendar/authorization/complete")
    @Operation(summary = "Google Calendar 인증 완료", description = "authorization code를 토큰으로 교환하고 저장합니다.")
    public ResponseEntity<TenantStatusResponse> completeAuth(
            @PathVariable String tenantId,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey,
            @Valid @RequestBody CompleteAuthRequest request
    ) {
        authenticate(apiKey, "POST /calendar/authorization/complete", tenantId);
        return ResponseEntity.ok(tenantCommandService.completeAuth(tenantId, request.getCode()));
    }

    @PutMapping("/source")
    @Operation(summary = "Quera 연동", description = "Quera session_id를 검증 후 암호화하여 저장합니다.")
    public ResponseEntity<TenantStatusResponse> connectSource(
            @PathVariable String tenantId,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey,
            @Valid @RequestBody ConnectSourceRequest request
    ) {
        authenticate(apiKey, "PUT /source", tenantId);
        return ResponseEntity.ok(tenantCommandService.connectSource(tenantId, request.getSessionToken()));
    }

    @DeleteMapping("/connections/{which}")
    @Operation(summary = "연동 해제", description = "which: calendar 또는 source. 자동 동기화 설정은 유지됩니다.")
    public ResponseEntity<TenantStatusResponse> disconnect(
            @PathVariable String tenantId,
            @PathVariable String which,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey
    ) {
        authenticate(apiKey, "DELETE /connections/" + which, tenantId);
        return ResponseEntity.ok(tenantCommandService.disconnect(tenantId, ConnectionType.from(which)));
    }

    @PostMapping("/sync")
    @Operation(summary = "즉시 동기화", description = "Quera 과제 마감을 Google Calendar에 반영합니다.")
    public ResponseEntity<SyncResultResponse> syncNow(
            @PathVariable String tenantId,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey
    ) {
        authenticate(apiKey, "POST /sync", tenantId);
        return ResponseEntity.ok(tenantCommandService.syncNow(tenantId));
    }

    @PutMapping("/auto-sync")
    @Operation(summary = "자동 동기화 설정", description = "켜면 3시간마다 동기화합니다. 재시작 후에도 유지됩니다.")
    public ResponseEntity<TenantStatusResponse> setAutoSync(
            @PathVariable String tenantId,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey,
            @Valid @RequestBody AutoSyncRequest request
    ) {
        authenticate(apiKey, "PUT /auto-sync", tenantId);
        return ResponseEntity.ok(tenantCommandService.setAutoSync(tenantId, request.getEnabled()));
    }

    @GetMapping("/status")
    @Operation(summary = "연동 상태 조회")
    public ResponseEntity<TenantStatusResponse> getStatus(
            @PathVariable String tenantId,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey
    ) {
        authenticate(apiKey, "GET /status", tenantId);
        return ResponseEntity.ok(tenantCommandService.getStatus(tenantId));
    }

    @DeleteMapping
    @Operation(summary = "계정 삭제", description = "자동 동기화를 끄고 저장된 자격 증명과 상태를 모두 삭제합니다.")
    public ResponseEntity<Void> deleteAccount(
            @PathVariable String tenantId,
            @RequestHeader(value = "X-Api-Key", required = false) String apiKey
    ) {
        authenticate(apiKey, "DELETE", tenantId);
        tenantCommandService.deleteAccount(tenantId);
        return ResponseEntity.noContent().build();
    }

    private void authenticate(String apiKey, String action, String tenantId) {
        String caller = serviceAuthValidator.validateAndGetCaller(apiKey);
        log.info("{} - tenantId={}, caller={}", action, tenantId, caller);
    }
}
