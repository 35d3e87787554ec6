package com.edusync.sync.credential.service;

import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.credential.client.GoogleOAuthClient;
import com.edusync.sync.credential.client.GoogleTokenResponse;
import com.edusync.sync.credential.exception.AuthFlowNotStartedException;
import com.edusync.sync.credential.model.TenantCredential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Google Calendar 연동(OAuth 인증) 흐름
 *
 * startAuth → 사용자가 인증 URL에서 동의 후 code 전달 → completeAuth
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarAuthService {

    private static final String STATE_CHARACTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int STATE_LENGTH = 30;

    private final GoogleOAuthClient oauthClient;
    private final CredentialStore credentialStore;
    private final EduSyncProperties properties;
    private final Clock clock;

    private final SecureRandom secureRandom = new SecureRandom();
    private final Map<String, PendingAuthorization> pendingFlows = new ConcurrentHashMap<>();

    /**
     * 인증 흐름을 시작하고 인증 URL을 반환합니다. 진행 중인 흐름이 있으면 교체됩니다.
     */
    public String startAuth(String tenantId) {
        String state = generateState();
        pendingFlows.put(tenantId, new PendingAuthorization(state, clock.instant()));
        log.info("Started calendar authorization: tenantId={}", tenantId);
        return oauthClient.authorizationUrl(state);
    }

    /**
     * authorization code를 토큰으로 교환해 저장합니다.
     *
     * @throws AuthFlowNotStartedException startAuth를 호출하지 않았거나 흐름이 만료된 경우
     */
    public TenantCredential completeAuth(String tenantId, String code) {
        PendingAuthorization pending = pendingFlows.remove(tenantId);
        if (pending == null || pending.isExpired(clock.instant(), properties.getCredential().getAuthStateTtl())) {
            throw new AuthFlowNotStartedException("Authorization flow not started for tenant: " + tenantId);
        }

        GoogleTokenResponse response = oauthClient.exchangeCode(code.strip());
        TenantCredential previous = credentialStore.load(tenantId).orElse(null);
        TenantCredential credential = credentialStore.fromTokenResponse(tenantId, response, previous, clock.instant());
        credentialStore.save(credential);

        log.info("✅ Calendar authorization completed: tenantId={}", tenantId);
        return credential;
    }

    public boolean hasPendingFlow(String tenantId) {
        PendingAuthorization pending = pendingFlows.get(tenantId);
        return pending != null && !pending.isExpired(clock.instant(), properties.getCredential().getAuthStateTtl());
    }

    public void cancel(String tenantId) {
        pendingFlows.remove(tenantId);
    }

    private String generateState() {
        StringBuilder state = new StringBuilder(STATE_LENGTH);
        for (int i = 0; i < STATE_LENGTH; i++) {
            state.append(STATE_CHARACTERS.charAt(secureRandom.nextInt(STATE_CHARACTERS.length())));
        }
        return state.toString();
    }

    private record PendingAuthorization(String state, Instant startedAt) {

        boolean isExpired(Instant now, Duration ttl) {
            return now.isAfter(startedAt.plus(ttl));
        }
    }
}
