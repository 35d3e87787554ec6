package com.edusync.sync.common.store;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON 파일 하나에 전체 맵을 저장하는 {@link KeyValueStore}.
 *
 * <p>쓰기는 "전체 읽기 → 해당 키 병합 → 임시 파일 기록 → 원자적 이동" 순서로 진행되며,
 * 프로세스 내 단일 락으로 직렬화됩니다. 서로 다른 tenant의 동시 저장이 서로의 항목을
 * 덮어쓰지 않습니다.</p>
 */
@Slf4j
public class JsonFileStore<V> implements KeyValueStore<V> {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final JavaType mapType;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileStore(Path file, ObjectMapper objectMapper, Class<V> valueType) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.mapType = objectMapper.getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, valueType);
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(readAll().get(key));
    }

    @Override
    public void put(String key, V value) {
        writeLock.lock();
        try {
            Map<String, V> all = readAll();
            all.put(key, value);
            writeAll(all);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void remove(String key) {
        writeLock.lock();
        try {
            Map<String, V> all = readAll();
            if (all.remove(key) != null) {
                writeAll(all);
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Map<String, V> findAll() {
        return Collections.unmodifiableMap(readAll());
    }

    private Map<String, V> readAll() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            if (Files.size(file) == 0) {
                return new LinkedHashMap<>();
            }
            Map<String, V> all = objectMapper.readValue(file.toFile(), mapType);
            return all != null ? all : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new StoreAccessException("Failed to read store file: " + file, e);
        }
    }

    private void writeAll(Map<String, V> all) {
        Path temp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), all);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StoreAccessException("Failed to write store file: " + file, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", temp, e.getMessage());
        }
    }
}
