package com.edusync.sync.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.HttpURLConnection;

/**
 * 외부 API 호출용 RestTemplate 설정
 * 모든 호출에 연결/읽기 타임아웃을 적용합니다.
 */
@Configuration
public class HttpClientConfig {

    /**
     * Google OAuth / Calendar API 호출용
     */
    @Bean
    @Primary
    public RestTemplate restTemplate(EduSyncProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        applyTimeouts(factory, properties);
        return new RestTemplate(factory);
    }

    /**
     * Quera 페이지 조회용
     * 로그인 페이지로의 리다이렉트를 감지해야 하므로 리다이렉트를 따라가지 않습니다.
     */
    @Bean
    public RestTemplate sourceRestTemplate(EduSyncProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        applyTimeouts(factory, properties);
        return new RestTemplate(factory);
    }

    private void applyTimeouts(SimpleClientHttpRequestFactory factory, EduSyncProperties properties) {
        factory.setConnectTimeout((int) properties.getHttp().getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getHttp().getReadTimeout().toMillis());
    }
}
