package com.edusync.sync.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * EduSync 설정 프로퍼티
 *
 * application.yml의 edusync 설정을 바인딩합니다.
 * 필수 값이 비어 있으면 애플리케이션 시작 시 에러가 발생합니다.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "edusync")
public class EduSyncProperties {

    /**
     * 마감일 해석 및 종일 일정에 사용하는 고정 시간대
     */
    @NotNull
    private ZoneId timezone = ZoneId.of("Asia/Tehran");

    @Valid
    private Encryption encryption = new Encryption();

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Sync sync = new Sync();

    @Valid
    private Http http = new Http();

    @Valid
    private Google google = new Google();

    @Valid
    private Quera quera = new Quera();

    @Valid
    private Credential credential = new Credential();

    @Data
    public static class Encryption {
        /**
         * Base64 인코딩된 AES-256 키
         * 환경 변수: EDUSYNC_ENCRYPTION_KEY
         */
        @NotBlank(message = "EDUSYNC_ENCRYPTION_KEY must be configured. Please check your .env file.")
        private String key;
    }

    @Data
    public static class Storage {
        /**
         * tenantId → 암호화된 자격 증명 JSON 파일
         */
        @NotBlank
        private String credentialsFile = "data/user_tokens.json";

        /**
         * tenantId → 연동/자동 동기화 상태 JSON 파일
         */
        @NotBlank
        private String tenantStateFile = "data/user_data.json";
    }

    @Data
    public static class Sync {
        /**
         * 자동 동기화 주기 (기본 3시간)
         */
        @NotNull
        private Duration interval = Duration.ofHours(3);

        /**
         * 자동 동기화 활성화 후 첫 실행까지의 지연
         */
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(10);

        /**
         * 자동 동기화 스케줄러 스레드 수
         */
        private int schedulerPoolSize = 4;

        /**
         * 기존 일정 검색 범위 (마감일 기준 앞뒤)
         */
        @NotNull
        private Duration lookupWindow = Duration.ofDays(90);
    }

    @Data
    public static class Http {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Google {
        /**
         * 환경 변수: GOOGLE_CLIENT_ID
         */
        private String clientId;

        /**
         * 환경 변수: GOOGLE_CLIENT_SECRET
         */
        private String clientSecret;

        /**
         * 환경 변수: GOOGLE_REDIRECT_URI
         */
        private String redirectUri = "urn:ietf:wg:oauth:2.0:oob";

        private String authUri = "https://accounts.google.com/o/oauth2/v2/auth";

        private String tokenUri = "https://oauth2.googleapis.com/token";

        private String calendarApiUrl = "https://www.googleapis.com/calendar/v3";

        private String calendarId = "primary";

        private String scope = "https://www.googleapis.com/auth/calendar";
    }

    @Data
    public static class Quera {
        private String baseUrl = "https://quera.org";

        private String coursePath = "/course";
    }

    @Data
    public static class Credential {
        /**
         * 만료 시각 이전이라도 이 시간 안에 만료되면 갱신
         */
        @NotNull
        private Duration expirySkew = Duration.ofSeconds(60);

        /**
         * startAuth 이후 completeAuth를 기다리는 최대 시간
         */
        @NotNull
        private Duration authStateTtl = Duration.ofMinutes(10);
    }
}
