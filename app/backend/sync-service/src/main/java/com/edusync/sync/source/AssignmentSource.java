package com.edusync.sync.source;

import com.edusync.sync.deadline.model.RawAssignment;
import com.edusync.sync.source.exception.SourceException;

import java.util.List;

/**
 * 과제 마감 목록을 제공하는 외부 포털
 */
public interface AssignmentSource {

    /**
     * @param sessionToken 포털 로그인 세션
     * @return 화면 순서대로의 과제 목록 (마감 섹션이 없으면 빈 목록)
     * @throws SourceException 세션이 유효하지 않거나(SESSION_INVALID) 포털에 접근할 수 없는 경우(UNAVAILABLE)
     */
    List<RawAssignment> fetchAssignments(String sessionToken);

    /**
     * @return 포털이 세션을 받아들이면 true
     * @throws SourceException 포털에 접근할 수 없는 경우(UNAVAILABLE)
     */
    boolean isSessionValid(String sessionToken);
}
