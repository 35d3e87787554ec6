package com.edusync.sync.common.store;

/**
 * 저장 파일 읽기/쓰기 실패
 */
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
