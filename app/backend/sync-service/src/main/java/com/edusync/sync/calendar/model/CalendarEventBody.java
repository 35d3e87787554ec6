package com.edusync.sync.calendar.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * 생성/수정할 종일 일정 내용
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEventBody {

    public static final String STABLE_ID_PROPERTY = "queraAssignmentId";
    public static final String SOURCE_PROPERTY = "source";
    public static final String SOURCE_VALUE = "quera-automation";

    private String title;

    private String description;

    private LocalDate startDate;

    /**
     * 배타적 종료일 (마감일 다음 날)
     */
    private LocalDate endDate;

    private String timeZone;

    /**
     * private 확장 속성 (queraAssignmentId, source)
     */
    private Map<String, String> privateProperties;
}
