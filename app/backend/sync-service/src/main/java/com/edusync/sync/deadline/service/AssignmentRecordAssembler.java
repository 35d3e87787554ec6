package com.edusync.sync.deadline.service;

import com.edusync.sync.deadline.date.PersianDateNormalizer;
import com.edusync.sync.deadline.exception.DeadlineParseException;
import com.edusync.sync.deadline.model.AssignmentBatch;
import com.edusync.sync.deadline.model.AssignmentRecord;
import com.edusync.sync.deadline.model.RawAssignment;
import com.edusync.sync.reconcile.model.FailureKind;
import com.edusync.sync.reconcile.model.SyncFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * RawAssignment → AssignmentRecord 변환
 *
 * 날짜 해석 실패는 배치 전체를 중단하지 않고 INVALID_DATE 실패로 모읍니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentRecordAssembler {

    private final PersianDateNormalizer dateNormalizer;
    private final StableIdExtractor stableIdExtractor;

    public AssignmentBatch assemble(List<RawAssignment> rawAssignments, Instant referenceNow) {
        List<AssignmentRecord> records = new ArrayList<>();
        List<SyncFailure> rejected = new ArrayList<>();

        for (RawAssignment raw : rawAssignments) {
            String title = buildTitle(raw);
            try {
                records.add(toRecord(raw, title, referenceNow));
            } catch (DeadlineParseException e) {
                log.warn("Skipping assignment with unparseable deadline: title={}, dateText={}, reason={}",
                        title, raw.getDateText(), e.getMessage());
                String stableId = stableIdExtractor.extract(raw.getLink()).orElse(null);
                rejected.add(SyncFailure.of(stableId, title, FailureKind.INVALID_DATE, e.getMessage()));
            }
        }

        return new AssignmentBatch(records, rejected);
    }

    AssignmentRecord toRecord(RawAssignment raw, String title, Instant referenceNow) {
        LocalDate dueDate = dateNormalizer.normalize(raw.getDateText(), referenceNow);

        return AssignmentRecord.builder()
                .title(title)
                .stableId(stableIdExtractor.extract(raw.getLink()).orElse(null))
                .dueAt(dateNormalizer.endOfDay(dueDate))
                .windowStart(dateNormalizer.startOfDay(dueDate))
                .sourceLink(raw.getLink())
                .build();
    }

    /**
     * 일정 제목 형식: "{과제명} | {과목명}"
     */
    private String buildTitle(RawAssignment raw) {
        return String.format("%s | %s", raw.getTitle(), raw.getCourse());
    }
}
