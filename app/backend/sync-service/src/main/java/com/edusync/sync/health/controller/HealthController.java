package com.edusync.sync.health.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 호스팅 플랫폼 헬스 체크용 (API Key 불필요)
 */
@RestController
@Tag(name = "Health", description = "헬스 체크")
public class HealthController {

    @GetMapping(value = {"/", "/health"}, produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "헬스 체크", description = "항상 200 OK를 반환합니다.")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
