package com.edusync.sync.deadline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 소스 페이지에서 추출한 가공 전 과제 필드
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawAssignment {

    private String title;

    private String course;

    /**
     * "۲۵ اردیبهشت" 형식의 마감일
     */
    private String dateText;

    /**
     * 과제 페이지 절대 URL
     */
    private String link;
}
