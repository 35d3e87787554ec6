package com.edusync.sync.calendar.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 캘린더에 저장된 종일 일정
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteCalendarEntry {

    private String id;

    /**
     * private 확장 속성 queraAssignmentId
     */
    private String stableId;

    private String title;

    private String description;

    private LocalDate startDate;

    /**
     * 배타적 종료일
     */
    private LocalDate endDate;
}
