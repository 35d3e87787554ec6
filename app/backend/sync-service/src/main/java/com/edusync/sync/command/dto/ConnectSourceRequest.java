package com.edusync.sync.command.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Quera 연동 요청")
public class ConnectSourceRequest {

    @NotBlank(message = "Session token is required")
    @Schema(
        description = "quera.org 로그인 후 브라우저 쿠키의 session_id 값",
        requiredMode = Schema.RequiredMode.REQUIRED
    )
    private String sessionToken;
}
