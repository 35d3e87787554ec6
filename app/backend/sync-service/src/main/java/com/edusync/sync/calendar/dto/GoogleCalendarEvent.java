package com.edusync.sync.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Google Calendar API Event 리소스 (사용하는 필드만)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GoogleCalendarEvent {

    private String id;

    private String summary;

    private String description;

    private EventDateTime start;

    private EventDateTime end;

    private ExtendedProperties extendedProperties;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EventDateTime {
        /**
         * 종일 일정: yyyy-MM-dd
         */
        private String date;

        private String dateTime;

        private String timeZone;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ExtendedProperties {

        @JsonProperty("private")
        private Map<String, String> privateProperties;

        private Map<String, String> shared;
    }
}
