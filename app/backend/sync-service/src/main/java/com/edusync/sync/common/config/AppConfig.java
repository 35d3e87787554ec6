package com.edusync.sync.common.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EduSyncProperties.class)
public class AppConfig {

    @Bean
    public Clock clock(EduSyncProperties properties) {
        return Clock.system(properties.getTimezone());
    }
}
