package com.edusync.sync.common.exception;

import com.edusync.shared.security.exception.UnauthorizedException;
import com.edusync.sync.common.store.StoreAccessException;
import com.edusync.sync.credential.exception.AuthFlowNotStartedException;
import com.edusync.sync.credential.exception.CalendarAuthException;
import com.edusync.sync.credential.exception.OAuthTokenException;
import com.edusync.sync.source.exception.SourceException;
import com.edusync.sync.sync.exception.SyncInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * API Key 인증 실패
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        log.warn("인증 실패: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("UNAUTHORIZED", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorResponse);
    }

    /**
     * Google Calendar 재인증 필요
     */
    @ExceptionHandler(CalendarAuthException.class)
    public ResponseEntity<ErrorResponse> handleCalendarAuth(CalendarAuthException e) {
        log.warn("캘린더 인증 필요: tenantId={}, reason={}", e.getTenantId(), e.getReason());
        ErrorResponse errorResponse = new ErrorResponse("CALENDAR_AUTH_REQUIRED", e.getMessage(), e.getTenantId());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorResponse);
    }

    /**
     * completeAuth 전에 startAuth를 호출하지 않음
     */
    @ExceptionHandler(AuthFlowNotStartedException.class)
    public ResponseEntity<ErrorResponse> handleAuthFlowNotStarted(AuthFlowNotStartedException e) {
        log.warn("인증 흐름 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("AUTH_FLOW_NOT_STARTED", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * authorization code 교환 실패
     */
    @ExceptionHandler(OAuthTokenException.class)
    public ResponseEntity<ErrorResponse> handleOAuthToken(OAuthTokenException e) {
        if (e.isRejected()) {
            log.warn("authorization code 거부됨: {}", e.getMessage());
            ErrorResponse errorResponse = new ErrorResponse("INVALID_AUTHORIZATION_CODE", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
        }
        log.error("Google 토큰 엔드포인트 호출 실패: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("OAUTH_UNAVAILABLE", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorResponse);
    }

    /**
     * Quera 세션/접속 오류
     */
    @ExceptionHandler(SourceException.class)
    public ResponseEntity<ErrorResponse> handleSource(SourceException e) {
        log.warn("Quera 오류: reason={}, message={}", e.getReason(), e.getMessage());
        switch (e.getReason()) {
            case NOT_CONNECTED:
                return ResponseEntity.status(HttpStatus.FAILED_DEPENDENCY)
                        .body(new ErrorResponse("SOURCE_NOT_CONNECTED", e.getMessage()));
            case SESSION_INVALID:
                return ResponseEntity.status(HttpStatus.FAILED_DEPENDENCY)
                        .body(new ErrorResponse("SOURCE_SESSION_INVALID", e.getMessage()));
            default:
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                        .body(new ErrorResponse("SOURCE_UNAVAILABLE", e.getMessage()));
        }
    }

    /**
     * 같은 tenant의 동기화가 이미 실행 중
     */
    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<ErrorResponse> handleSyncInProgress(SyncInProgressException e) {
        log.info("동기화 진행 중: tenantId={}", e.getTenantId());
        ErrorResponse errorResponse = new ErrorResponse("SYNC_IN_PROGRESS", e.getMessage(), e.getTenantId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * 저장 파일 읽기/쓰기 실패
     */
    @ExceptionHandler(StoreAccessException.class)
    public ResponseEntity<ErrorResponse> handleStoreAccess(StoreAccessException e) {
        log.error("저장소 오류: {}", e.getMessage(), e);
        ErrorResponse errorResponse = new ErrorResponse("STORE_ERROR", "저장소 처리 중 오류가 발생했습니다.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    /**
     * 존재하지 않는 리소스/엔드포인트 처리 (404)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException e) {
        log.error("존재하지 않는 리소스: {} {}", e.getHttpMethod(), e.getResourcePath());
        ErrorResponse errorResponse = new ErrorResponse("NOT_FOUND", "요청한 API를 찾을 수 없습니다: " + e.getHttpMethod() + " " + e.getResourcePath());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * @Valid 검증 실패 시 처리
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, Object> response = new HashMap<>();
        Map<String, String> errors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        response.put("status", "error");
        response.put("message", "입력값 검증에 실패했습니다");
        response.put("errors", errors);

        log.warn("Validation 실패: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * 요청 본문이 없거나 JSON 형식이 잘못됨
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("요청 본문 파싱 실패: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("BAD_REQUEST", "요청 본문을 읽을 수 없습니다.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * IllegalArgumentException 처리 (400)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.error("잘못된 요청: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("BAD_REQUEST", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 모든 예외 처리 (최종 catch-all)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("예상치 못한 예외 발생: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
