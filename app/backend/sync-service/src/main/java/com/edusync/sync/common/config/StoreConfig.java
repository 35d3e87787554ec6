package com.edusync.sync.common.config;

import com.edusync.sync.common.store.JsonFileStore;
import com.edusync.sync.common.store.KeyValueStore;
import com.edusync.sync.tenant.model.TenantSyncState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * tenant별 저장소 설정
 * 파일 하나당 저장소 하나, 쓰기 락도 파일 단위입니다.
 */
@Configuration
public class StoreConfig {

    /**
     * tenantId → 암호화된 자격 증명 blob
     */
    @Bean
    public KeyValueStore<String> credentialFileStore(EduSyncProperties properties, ObjectMapper objectMapper) {
        return new JsonFileStore<>(Path.of(properties.getStorage().getCredentialsFile()), objectMapper, String.class);
    }

    /**
     * tenantId → 연동 상태
     */
    @Bean
    public KeyValueStore<TenantSyncState> tenantStateFileStore(EduSyncProperties properties, ObjectMapper objectMapper) {
        return new JsonFileStore<>(Path.of(properties.getStorage().getTenantStateFile()), objectMapper, TenantSyncState.class);
    }
}
