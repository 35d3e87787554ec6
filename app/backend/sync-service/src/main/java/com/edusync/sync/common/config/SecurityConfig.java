package com.edusync.sync.common.config;

import com.edusync.shared.security.ServiceAuthValidator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class SecurityConfig {

    @Bean
    public ServiceAuthValidator serviceAuthValidator(
            @Value("${edusync.api-keys.telegram-bot}") String telegramBotApiKey
    ) {
        Map<String, String> apiKeys = Map.of(
                telegramBotApiKey, "telegram-bot"
        );
        return new ServiceAuthValidator(apiKeys);
    }
}
