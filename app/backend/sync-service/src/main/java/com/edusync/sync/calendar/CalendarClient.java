package com.edusync.sync.calendar;

import com.edusync.sync.calendar.exception.RemoteCalendarException;
import com.edusync.sync.calendar.model.CalendarEventBody;
import com.edusync.sync.calendar.model.RemoteCalendarEntry;

import java.time.Instant;
import java.util.List;

/**
 * tenant 캘린더에 대한 종일 일정 CRUD
 * 모든 메서드는 실패 시 {@link RemoteCalendarException}을 던집니다.
 */
public interface CalendarClient {

    /**
     * private 확장 속성의 stableId가 일치하고 [timeMin, timeMax]와 겹치는 일정
     */
    List<RemoteCalendarEntry> findByStableId(String accessToken, String stableId, Instant timeMin, Instant timeMax);

    RemoteCalendarEntry create(String accessToken, CalendarEventBody body);

    RemoteCalendarEntry update(String accessToken, String entryId, CalendarEventBody body);

    void delete(String accessToken, String entryId);
}
