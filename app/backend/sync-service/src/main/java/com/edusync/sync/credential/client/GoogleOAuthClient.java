package com.edusync.sync.credential.client;

import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.credential.exception.OAuthTokenException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

/**
 * Google OAuth 2.0 클라이언트
 * 인증 URL 생성, authorization code 교환, access token 갱신을 담당합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoogleOAuthClient {

    private final RestTemplate restTemplate;
    private final EduSyncProperties properties;

    /**
     * offline access(refresh token 발급)를 요청하는 인증 URL
     */
    public String authorizationUrl(String state) {
        EduSyncProperties.Google google = properties.getGoogle();
        return UriComponentsBuilder.fromUriString(google.getAuthUri())
                .queryParam("client_id", google.getClientId())
                .queryParam("redirect_uri", google.getRedirectUri())
                .queryParam("response_type", "code")
                .queryParam("scope", google.getScope())
                .queryParam("access_type", "offline")
                .queryParam("include_granted_scopes", "true")
                .queryParam("prompt", "consent")
                .queryParam("state", state)
                .encode()
                .build()
                .toUriString();
    }

    /**
     * authorization code → 토큰
     *
     * @throws OAuthTokenException code가 거부되었거나 토큰 엔드포인트 호출 실패
     */
    public GoogleTokenResponse exchangeCode(String code) {
        MultiValueMap<String, String> form = baseForm();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", properties.getGoogle().getRedirectUri());
        return requestToken(form, "authorization_code");
    }

    /**
     * refresh token으로 access token 갱신
     *
     * @throws OAuthTokenException grant 거부 또는 호출 실패
     */
    public GoogleTokenResponse refresh(String refreshToken) {
        MultiValueMap<String, String> form = baseForm();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        return requestToken(form, "refresh_token");
    }

    private MultiValueMap<String, String> baseForm() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", properties.getGoogle().getClientId());
        form.add("client_secret", properties.getGoogle().getClientSecret());
        return form;
    }

    private GoogleTokenResponse requestToken(MultiValueMap<String, String> form, String grantType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            GoogleTokenResponse response = restTemplate.postForObject(
                    properties.getGoogle().getTokenUri(),
                    new HttpEntity<>(form, headers),
                    GoogleTokenResponse.class
            );

            if (response == null || response.getAccessToken() == null) {
                throw new OAuthTokenException("Token endpoint returned no access token", false);
            }
            return response;

        } catch (HttpClientErrorException e) {
            // 400 invalid_grant, 401 invalid_client 등은 재시도해도 성공하지 않음
            log.error("Google token request rejected: grantType={}, status={}, body={}",
                    grantType, e.getStatusCode(), e.getResponseBodyAsString());
            throw new OAuthTokenException("Token request rejected: " + e.getStatusCode(), true, e);
        } catch (RestClientException e) {
            log.error("Google token request failed: grantType={}, error={}", grantType, e.getMessage());
            throw new OAuthTokenException("Token request failed: " + e.getMessage(), false, e);
        }
    }
}
