package com.edusync.sync.reconcile.service;

import com.edusync.sync.calendar.CalendarClient;
import com.edusync.sync.calendar.exception.RemoteCalendarException;
import com.edusync.sync.calendar.model.CalendarEventBody;
import com.edusync.sync.calendar.model.RemoteCalendarEntry;
import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.credential.model.TenantCredential;
import com.edusync.sync.deadline.model.AssignmentRecord;
import com.edusync.sync.deadline.service.StableIdExtractor;
import com.edusync.sync.reconcile.model.FailureKind;
import com.edusync.sync.reconcile.model.ReconcileResult;
import com.edusync.sync.reconcile.model.SyncBatchResult;
import com.edusync.sync.reconcile.model.SyncFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 과제 마감 레코드를 tenant 캘린더에 반영합니다.
 *
 * <p>레코드마다 stableId로 기존 일정을 찾아 없으면 생성, 시작일이 다르면 수정, 같으면 건너뜁니다.
 * 같은 stableId의 일정이 여러 개면 첫 번째를 기준으로 처리하고 나머지는 삭제합니다.</p>
 *
 * <p>레코드 단위 오류는 FAILED 결과로 반환되며 예외로 전파되지 않습니다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadlineReconciler {

    static final String DESCRIPTION_PREFIX = "Assignment Link: ";

    private final CalendarClient calendarClient;
    private final StableIdExtractor stableIdExtractor;
    private final EduSyncProperties properties;

    public SyncBatchResult reconcileBatch(TenantCredential credential, List<AssignmentRecord> records) {
        List<ReconcileResult> results = new ArrayList<>(records.size());
        for (AssignmentRecord record : records) {
            results.add(reconcile(credential, record));
        }
        SyncBatchResult result = SyncBatchResult.from(results);
        log.info("Reconciled batch: tenantId={}, {}", credential.getTenantId(), result.summary());
        return result;
    }

    public ReconcileResult reconcile(TenantCredential credential, AssignmentRecord record) {
        String tenantId = credential.getTenantId();
        String stableId = resolveStableId(record);
        if (stableId == null) {
            log.warn("Could not extract assignment id: tenantId={}, title={}, link={}",
                    tenantId, record.getTitle(), record.getSourceLink());
            return ReconcileResult.failed(SyncFailure.of(null, record.getTitle(), FailureKind.MISSING_STABLE_ID,
                    "No assignment id in link: " + record.getSourceLink()));
        }

        List<RemoteCalendarEntry> matches;
        try {
            Duration window = properties.getSync().getLookupWindow();
            Instant timeMin = record.getWindowStart().toInstant().minus(window);
            Instant timeMax = record.getDueAt().toInstant().plus(window);
            matches = calendarClient.findByStableId(credential.getAccessToken(), stableId, timeMin, timeMax);
        } catch (RemoteCalendarException e) {
            log.error("Failed to query calendar: tenantId={}, stableId={}, status={}, error={}",
                    tenantId, stableId, e.getStatusCode(), e.getMessage());
            return ReconcileResult.failed(remoteFailure(stableId, record, FailureKind.REMOTE_QUERY, e));
        }

        CalendarEventBody body = buildEventBody(record, stableId);

        try {
            if (matches.isEmpty()) {
                calendarClient.create(credential.getAccessToken(), body);
                log.info("Created calendar event: tenantId={}, stableId={}, title={}, start={}",
                        tenantId, stableId, record.getTitle(), body.getStartDate());
                return ReconcileResult.created(stableId, record.getTitle());
            }

            RemoteCalendarEntry existing = matches.get(0);
            removeDuplicates(credential, stableId, matches);

            if (body.getStartDate().equals(existing.getStartDate())) {
                log.debug("Calendar event already up to date: tenantId={}, stableId={}", tenantId, stableId);
                return ReconcileResult.unchanged(stableId, record.getTitle());
            }

            calendarClient.update(credential.getAccessToken(), existing.getId(), body);
            log.info("Updated calendar event with new deadline: tenantId={}, stableId={}, from={}, to={}",
                    tenantId, stableId, existing.getStartDate(), body.getStartDate());
            return ReconcileResult.updated(stableId, record.getTitle());

        } catch (RemoteCalendarException e) {
            log.error("Failed to write calendar event: tenantId={}, stableId={}, status={}, error={}",
                    tenantId, stableId, e.getStatusCode(), e.getMessage());
            return ReconcileResult.failed(remoteFailure(stableId, record, FailureKind.REMOTE_WRITE, e));
        }
    }

    /**
     * 종일 일정 본문: [마감일, 마감일 + 1)
     */
    CalendarEventBody buildEventBody(AssignmentRecord record, String stableId) {
        Map<String, String> privateProperties = new LinkedHashMap<>();
        privateProperties.put(CalendarEventBody.STABLE_ID_PROPERTY, stableId);
        privateProperties.put(CalendarEventBody.SOURCE_PROPERTY, CalendarEventBody.SOURCE_VALUE);

        return CalendarEventBody.builder()
                .title(record.getTitle())
                .description(DESCRIPTION_PREFIX + record.getSourceLink())
                .startDate(record.eventStartDate())
                .endDate(record.eventEndDate())
                .timeZone(properties.getTimezone().getId())
                .privateProperties(privateProperties)
                .build();
    }

    private String resolveStableId(AssignmentRecord record) {
        if (record.getStableId() != null && !record.getStableId().isBlank()) {
            return record.getStableId();
        }
        return stableIdExtractor.extract(record.getSourceLink()).orElse(null);
    }

    /**
     * 첫 번째 일치 항목만 남기고 삭제합니다. 삭제 실패는 기록만 하고 결과에 영향을 주지 않습니다.
     */
    private void removeDuplicates(TenantCredential credential, String stableId, List<RemoteCalendarEntry> matches) {
        for (RemoteCalendarEntry duplicate : matches.subList(1, matches.size())) {
            try {
                calendarClient.delete(credential.getAccessToken(), duplicate.getId());
                log.warn("Deleted duplicate calendar event: tenantId={}, stableId={}, eventId={}",
                        credential.getTenantId(), stableId, duplicate.getId());
            } catch (RemoteCalendarException e) {
                log.error("Failed to delete duplicate calendar event: tenantId={}, stableId={}, eventId={}, error={}",
                        credential.getTenantId(), stableId, duplicate.getId(), e.getMessage());
            }
        }
    }

    private SyncFailure remoteFailure(String stableId, AssignmentRecord record, FailureKind kind,
                                      RemoteCalendarException e) {
        return SyncFailure.builder()
                .stableId(stableId)
                .title(record.getTitle())
                .kind(kind)
                .reason(e.getMessage())
                .retryable(e.isRetryable())
                .authorizationRequired(e.isAuthorizationError())
                .build();
    }
}
