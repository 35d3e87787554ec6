package com.edusync.sync.credential.service;

import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.common.config.EncryptionService;
import com.edusync.sync.common.store.JsonFileStore;
import com.edusync.sync.credential.client.GoogleOAuthClient;
import com.edusync.sync.credential.client.GoogleTokenResponse;
import com.edusync.sync.credential.exception.CalendarAuthException;
import com.edusync.sync.credential.exception.CalendarAuthException.Reason;
import com.edusync.sync.credential.exception.OAuthTokenException;
import com.edusync.sync.credential.model.TenantCredential;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

/**
 * CredentialStore 단위 테스트
 * 실제 파일 저장소와 암호화를 사용하고 Google 토큰 엔드포인트만 Mock으로 대체합니다.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CredentialStore 테스트")
class CredentialStoreTest {

    private static final String TENANT_ID = "tenant-42";
    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    @TempDir
    Path tempDir;

    @Mock
    private GoogleOAuthClient oauthClient;

    private Path credentialsFile;
    private CredentialStore credentialStore;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        credentialsFile = tempDir.resolve("user_tokens.json");

        EduSyncProperties properties = new EduSyncProperties();
        properties.getEncryption().setKey(EncryptionService.generateKey());

        credentialStore = new CredentialStore(
                new JsonFileStore<>(credentialsFile, objectMapper, String.class),
                new EncryptionService(properties),
                objectMapper,
                oauthClient,
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    @DisplayName("저장한 자격 증명을 그대로 읽고, 파일에는 평문 토큰이 없음")
    void saveAndLoad() throws Exception {
        // Given
        TenantCredential credential = credential(NOW.plusSeconds(3600), "refresh-token");

        // When
        credentialStore.save(credential);

        // Then
        assertThat(credentialStore.load(TENANT_ID)).contains(credential);
        assertThat(Files.readString(credentialsFile))
                .contains(TENANT_ID)
                .doesNotContain("access-token")
                .doesNotContain("refresh-token");
    }

    @Test
    @DisplayName("만료되지 않은 자격 증명은 갱신하지 않음")
    void ensureFresh_NotExpired() {
        // Given
        TenantCredential credential = credential(NOW.plusSeconds(3600), "refresh-token");
        credentialStore.save(credential);

        // When
        TenantCredential result = credentialStore.ensureFresh(TENANT_ID);

        // Then
        assertThat(result).isEqualTo(credential);
        then(oauthClient).should(never()).refresh(anyString());
    }

    @Test
    @DisplayName("60초 이내 만료 예정이면 갱신 후 저장, 새 refresh token이 없으면 기존 유지")
    void ensureFresh_RefreshWithinSkew() {
        // Given
        credentialStore.save(credential(NOW.plusSeconds(30), "refresh-token"));
        given(oauthClient.refresh("refresh-token")).willReturn(GoogleTokenResponse.builder()
                .accessToken("new-access-token")
                .expiresIn(3599L)
                .build());

        // When
        TenantCredential result = credentialStore.ensureFresh(TENANT_ID);

        // Then
        assertThat(result.getAccessToken()).isEqualTo("new-access-token");
        assertThat(result.getRefreshToken()).isEqualTo("refresh-token");
        assertThat(result.getExpiry()).isEqualTo(NOW.plusSeconds(3599));
        assertThat(result.getScope()).isEqualTo("https://www.googleapis.com/auth/calendar");
        assertThat(credentialStore.load(TENANT_ID)).contains(result);
    }

    @Test
    @DisplayName("갱신 응답에 새 refresh token이 있으면 교체")
    void ensureFresh_RotatedRefreshToken() {
        // Given
        credentialStore.save(credential(NOW.minusSeconds(10), "old-refresh"));
        given(oauthClient.refresh("old-refresh")).willReturn(GoogleTokenResponse.builder()
                .accessToken("new-access-token")
                .refreshToken("new-refresh")
                .expiresIn(3600L)
                .build());

        // When
        TenantCredential result = credentialStore.ensureFresh(TENANT_ID);

        // Then
        assertThat(result.getRefreshToken()).isEqualTo("new-refresh");
    }

    @Test
    @DisplayName("자격 증명이 없으면 NOT_CONNECTED")
    void ensureFresh_Missing() {
        assertThatThrownBy(() -> credentialStore.ensureFresh(TENANT_ID))
                .isInstanceOf(CalendarAuthException.class)
                .extracting("reason")
                .isEqualTo(Reason.NOT_CONNECTED);
    }

    @Test
    @DisplayName("만료되었고 refresh token이 없으면 REFRESH_REJECTED, 토큰 엔드포인트 호출 없음")
    void ensureFresh_ExpiredWithoutRefreshToken() {
        // Given
        credentialStore.save(credential(NOW.minusSeconds(10), null));

        // When & Then
        assertThatThrownBy(() -> credentialStore.ensureFresh(TENANT_ID))
                .isInstanceOf(CalendarAuthException.class)
                .extracting("reason")
                .isEqualTo(Reason.REFRESH_REJECTED);
        then(oauthClient).should(never()).refresh(anyString());
    }

    @Test
    @DisplayName("Google이 grant를 거부하면 REFRESH_REJECTED, 저장된 자격 증명은 유지")
    void ensureFresh_Rejected() {
        // Given
        TenantCredential credential = credential(NOW.minusSeconds(10), "refresh-token");
        credentialStore.save(credential);
        given(oauthClient.refresh("refresh-token"))
                .willThrow(new OAuthTokenException("Token request rejected: 400", true));

        // When & Then
        assertThatThrownBy(() -> credentialStore.ensureFresh(TENANT_ID))
                .isInstanceOf(CalendarAuthException.class)
                .extracting("reason")
                .isEqualTo(Reason.REFRESH_REJECTED);
        assertThat(credentialStore.load(TENANT_ID)).contains(credential);
    }

    @Test
    @DisplayName("네트워크 오류는 REFRESH_FAILED")
    void ensureFresh_NetworkError() {
        // Given
        credentialStore.save(credential(NOW.minusSeconds(10), "refresh-token"));
        given(oauthClient.refresh("refresh-token"))
                .willThrow(new OAuthTokenException("Token request failed: timeout", false));

        // When & Then
        assertThatThrownBy(() -> credentialStore.ensureFresh(TENANT_ID))
                .isInstanceOf(CalendarAuthException.class)
                .extracting("reason")
                .isEqualTo(Reason.REFRESH_FAILED);
    }

    @Test
    @DisplayName("삭제 후에는 조회되지 않음")
    void delete() {
        credentialStore.save(credential(NOW.plusSeconds(3600), "refresh-token"));

        credentialStore.delete(TENANT_ID);

        assertThat(credentialStore.load(TENANT_ID)).isEmpty();
    }

    private TenantCredential credential(Instant expiry, String refreshToken) {
        return TenantCredential.builder()
                .tenantId(TENANT_ID)
                .accessToken("access-token")
                .refreshToken(refreshToken)
                .expiry(expiry)
                .scope("https://www.googleapis.com/auth/calendar")
                .build();
    }
}
