package com.edusync.shared.security;

import com.edusync.shared.security.exception.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ServiceAuthValidator 단위 테스트")
class ServiceAuthValidatorTest {

    private ServiceAuthValidator validator;

    @BeforeEach
    void setUp() {
        Map<String, String> keys = new HashMap<>();
        keys.put("bot-key-123", "telegram-bot");
        keys.put("", "blank-caller");
        validator = new ServiceAuthValidator(keys);
    }

    @Test
    @DisplayName("등록된 API Key - 호출자 이름 반환")
    void validateAndGetCaller_Success() {
        assertThat(validator.validateAndGetCaller("bot-key-123")).isEqualTo("telegram-bot");
        assertThat(validator.isValid("bot-key-123")).isTrue();
    }

    @Test
    @DisplayName("API Key 누락 - UnauthorizedException")
    void validateAndGetCaller_Missing() {
        assertThatThrownBy(() -> validator.validateAndGetCaller(null))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("API Key is required");
        assertThatThrownBy(() -> validator.validateAndGetCaller("  "))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("등록되지 않은 API Key - UnauthorizedException")
    void validateAndGetCaller_Unknown() {
        assertThatThrownBy(() -> validator.validateAndGetCaller("other-key"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid API Key");
        assertThat(validator.isValid("other-key")).isFalse();
    }

    @Test
    @DisplayName("빈 문자열 키는 등록되지 않음")
    void blankKeyIsIgnored() {
        assertThat(validator.isValid("")).isFalse();
    }
}
