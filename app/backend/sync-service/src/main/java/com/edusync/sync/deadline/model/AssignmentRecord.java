package com.edusync.sync.deadline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * 캘린더에 반영할 과제 마감 하나
 *
 * stableId는 마감일이 바뀌어도 변하지 않으며 캘린더 일정 중복 판단의 유일한 기준입니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentRecord {

    /**
     * "{과제명} | {과목명}"
     */
    private String title;

    /**
     * sourceLink의 /assignments/{digits}/ 부분. 추출 실패 시 null
     */
    private String stableId;

    /**
     * 마감일 23:59:59 (고정 시간대)
     */
    private ZonedDateTime dueAt;

    /**
     * 마감일 00:00:00 (고정 시간대)
     */
    private ZonedDateTime windowStart;

    private String sourceLink;

    /**
     * 종일 일정 시작일
     */
    public LocalDate eventStartDate() {
        return windowStart.toLocalDate();
    }

    /**
     * 종일 일정 종료일 (마감일 다음 날, 배타적)
     */
    public LocalDate eventEndDate() {
        return dueAt.toLocalDate().plusDays(1);
    }
}
