package com.edusync.shared.security;

import com.edusync.shared.security.exception.UnauthorizedException;

import java.util.HashMap;
import java.util.Map;

/**
 * 커맨드 API를 호출하는 프론트엔드의 API Key를 검증합니다.
 *
 * <p>프론트엔드(예: 텔레그램 봇)마다 고유한 API Key를 가지며, 검증에 성공하면
 * 호출자 이름을 돌려줍니다. 로그에 호출자를 남길 때 사용합니다.</p>
 *
 * <pre>
 * ServiceAuthValidator validator = new ServiceAuthValidator(Map.of("key-123", "telegram-bot"));
 * String caller = validator.validateAndGetCaller("key-123"); // "telegram-bot"
 * </pre>
 */
public class ServiceAuthValidator {

    private final Map<String, String> apiKeyToCaller;

    /**
     * @param apiKeyToCaller API Key → 호출자 이름 매핑. 빈 키는 무시됩니다.
     */
    public ServiceAuthValidator(Map<String, String> apiKeyToCaller) {
        this.apiKeyToCaller = new HashMap<>();
        apiKeyToCaller.forEach((key, caller) -> {
            if (key != null && !key.isBlank()) {
                this.apiKeyToCaller.put(key, caller);
            }
        });
    }

    /**
     * API Key를 검증하고 호출자 이름을 반환합니다.
     *
     * @param apiKey 요청 헤더(X-Api-Key)의 값
     * @return 호출자 이름
     * @throws UnauthorizedException API Key가 없거나 등록되지 않은 경우
     */
    public String validateAndGetCaller(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new UnauthorizedException("API Key is required");
        }

        String caller = apiKeyToCaller.get(apiKey);
        if (caller == null) {
            throw new UnauthorizedException("Invalid API Key");
        }

        return caller;
    }

    public boolean isValid(String apiKey) {
        return apiKey != null && !apiKey.isBlank() && apiKeyToCaller.containsKey(apiKey);
    }
}
