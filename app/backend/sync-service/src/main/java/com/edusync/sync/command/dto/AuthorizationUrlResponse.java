package com.edusync.sync.command.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Google Calendar 인증 URL")
public class AuthorizationUrlResponse {

    @Schema(description = "사용자가 열어 동의할 Google 인증 URL")
    private String authUrl;
}
