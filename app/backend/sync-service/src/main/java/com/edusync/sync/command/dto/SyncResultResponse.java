package com.edusync.sync.command.dto;

import com.edusync.sync.reconcile.model.SyncBatchResult;
import com.edusync.sync.reconcile.model.SyncFailure;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "동기화 패스 결과")
public class SyncResultResponse {

    @Schema(description = "새로 추가된 과제 수")
    private int created;

    @Schema(description = "마감일이 변경되어 수정된 과제 수")
    private int updated;

    @Schema(description = "이미 반영되어 있던 과제 수")
    private int unchanged;

    @Schema(description = "실패한 과제 수")
    private int failed;

    @Schema(description = "전체 과제 수")
    private int total;

    @Schema(description = "생성/수정/유지된 과제 수")
    private int succeeded;

    @Schema(description = "캘린더가 모든 요청을 거부하여 재연동이 필요함")
    private boolean calendarReconnectRequired;

    private List<SyncFailure> failures;

    public static SyncResultResponse from(SyncBatchResult result) {
        return SyncResultResponse.builder()
                .created(result.getCreated())
                .updated(result.getUpdated())
                .unchanged(result.getUnchanged())
                .failed(result.getFailed())
                .total(result.getTotal())
                .succeeded(result.getSucceeded())
                .calendarReconnectRequired(result.isCalendarAuthorizationLost())
                .failures(result.getFailures())
                .build();
    }
}
