package com.edusync.sync.credential.service;

import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.common.config.EncryptionService;
import com.edusync.sync.common.store.KeyValueStore;
import com.edusync.sync.common.store.StoreAccessException;
import com.edusync.sync.credential.client.GoogleOAuthClient;
import com.edusync.sync.credential.client.GoogleTokenResponse;
import com.edusync.sync.credential.exception.CalendarAuthException;
import com.edusync.sync.credential.exception.CalendarAuthException.Reason;
import com.edusync.sync.credential.exception.OAuthTokenException;
import com.edusync.sync.credential.model.TenantCredential;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * tenant별 Google 자격 증명 저장소
 *
 * 자격 증명은 JSON 직렬화 후 AES-GCM으로 암호화되어 저장됩니다.
 * ensureFresh는 만료가 임박한 토큰을 갱신하고 결과를 즉시 저장합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    private final KeyValueStore<String> credentialFileStore;
    private final EncryptionService encryptionService;
    private final ObjectMapper objectMapper;
    private final GoogleOAuthClient oauthClient;
    private final EduSyncProperties properties;
    private final Clock clock;

    public Optional<TenantCredential> load(String tenantId) {
        return credentialFileStore.get(tenantId).map(blob -> deserialize(tenantId, blob));
    }

    public void save(TenantCredential credential) {
        try {
            String json = objectMapper.writeValueAsString(credential);
            credentialFileStore.put(credential.getTenantId(), encryptionService.encrypt(json));
            log.debug("Saved calendar credential: tenantId={}, expiry={}",
                    credential.getTenantId(), credential.getExpiry());
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("Failed to serialize credential: tenantId=" + credential.getTenantId(), e);
        }
    }

    public void delete(String tenantId) {
        credentialFileStore.remove(tenantId);
        log.info("Deleted calendar credential: tenantId={}", tenantId);
    }

    /**
     * 사용 가능한 자격 증명을 반환합니다. 만료(또는 임박) 시 갱신 후 저장합니다.
     *
     * @throws CalendarAuthException 자격 증명이 없거나 갱신할 수 없는 경우
     */
    public TenantCredential ensureFresh(String tenantId) {
        TenantCredential credential = load(tenantId)
                .orElseThrow(() -> new CalendarAuthException(tenantId, Reason.NOT_CONNECTED,
                        "Google Calendar is not connected"));

        Instant now = clock.instant();
        if (!credential.isExpired(now, properties.getCredential().getExpirySkew())) {
            return credential;
        }

        if (!credential.hasRefreshToken()) {
            log.warn("Calendar credential expired without refresh token: tenantId={}", tenantId);
            throw new CalendarAuthException(tenantId, Reason.REFRESH_REJECTED,
                    "Calendar credential expired and cannot be refreshed");
        }

        GoogleTokenResponse response;
        try {
            response = oauthClient.refresh(credential.getRefreshToken());
        } catch (OAuthTokenException e) {
            Reason reason = e.isRejected() ? Reason.REFRESH_REJECTED : Reason.REFRESH_FAILED;
            log.warn("Calendar credential refresh failed: tenantId={}, reason={}", tenantId, reason);
            throw new CalendarAuthException(tenantId, reason, "Failed to refresh calendar credential", e);
        }

        TenantCredential refreshed = fromTokenResponse(tenantId, response, credential, now);
        save(refreshed);
        log.info("Refreshed calendar credential: tenantId={}, expiry={}", tenantId, refreshed.getExpiry());
        return refreshed;
    }

    /**
     * 토큰 응답으로 자격 증명을 만듭니다. 응답에 없는 refresh token/scope는 기존 값을 유지합니다.
     *
     * @param previous 기존 자격 증명 (최초 인증이면 null)
     */
    public TenantCredential fromTokenResponse(String tenantId, GoogleTokenResponse response,
                                              TenantCredential previous, Instant now) {
        String refreshToken = response.getRefreshToken();
        if ((refreshToken == null || refreshToken.isBlank()) && previous != null) {
            refreshToken = previous.getRefreshToken();
        }
        String scope = response.getScope();
        if (scope == null && previous != null) {
            scope = previous.getScope();
        }

        return TenantCredential.builder()
                .tenantId(tenantId)
                .accessToken(response.getAccessToken())
                .refreshToken(refreshToken)
                .expiry(response.getExpiresIn() != null ? now.plusSeconds(response.getExpiresIn()) : null)
                .scope(scope)
                .build();
    }

    private TenantCredential deserialize(String tenantId, String blob) {
        try {
            return objectMapper.readValue(encryptionService.decrypt(blob), TenantCredential.class);
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new StoreAccessException("Unreadable calendar credential: tenantId=" + tenantId, e);
        }
    }
}
