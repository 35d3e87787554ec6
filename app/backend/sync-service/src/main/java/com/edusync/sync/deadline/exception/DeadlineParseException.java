package com.edusync.sync.deadline.exception;

/**
 * 스크래핑된 마감일 문자열을 날짜로 해석하지 못한 경우 (레코드 단위 실패)
 */
public abstract class DeadlineParseException extends RuntimeException {

    protected DeadlineParseException(String message) {
        super(message);
    }

    protected DeadlineParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
