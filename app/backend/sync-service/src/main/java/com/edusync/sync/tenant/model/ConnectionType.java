package com.edusync.sync.tenant.model;

import java.util.Locale;

/**
 * 연동 해제 대상
 */
public enum ConnectionType {
    CALENDAR,
    SOURCE;

    /**
     * "calendar" / "source" (대소문자 무시)
     *
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static ConnectionType from(String value) {
        if (value != null) {
            for (ConnectionType type : values()) {
                if (type.name().equals(value.strip().toUpperCase(Locale.ROOT))) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown connection type: " + value + " (expected calendar or source)");
    }
}
