package com.edusync.sync.command.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "자동 동기화 설정 요청")
public class AutoSyncRequest {

    @NotNull(message = "enabled is required")
    @Schema(description = "true: 3시간마다 자동 동기화", requiredMode = Schema.RequiredMode.REQUIRED)
    private Boolean enabled;
}
