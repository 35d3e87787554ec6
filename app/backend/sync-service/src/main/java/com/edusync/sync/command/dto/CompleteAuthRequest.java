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
@Schema(description = "Google Calendar 인증 완료 요청")
public class CompleteAuthRequest {

    @NotBlank(message = "Authorization code is required")
    @Schema(
        description = "Google 동의 화면에서 발급된 authorization code",
        example = "4/0AfJohXn...",
        requiredMode = Schema.RequiredMode.REQUIRED
    )
    private String code;
}
