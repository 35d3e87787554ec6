package com.edusync.sync.common.store;

import java.util.Map;
import java.util.Optional;

/**
 * tenantId를 키로 하는 단순 get/put 저장소
 *
 * @param <V> 저장 값 타입
 */
public interface KeyValueStore<V> {

    Optional<V> get(String key);

    void put(String key, V value);

    void remove(String key);

    /**
     * 전체 항목의 스냅샷 (재시작 시 자동 동기화 복원용)
     */
    Map<String, V> findAll();
}
