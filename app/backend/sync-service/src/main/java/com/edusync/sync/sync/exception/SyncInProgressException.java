package com.edusync.sync.sync.exception;

import lombok.Getter;

@Getter
public class SyncInProgressException extends RuntimeException {

    private final String tenantId;

    public SyncInProgressException(String tenantId) {
        super("Sync already in progress for tenant: " + tenantId);
        this.tenantId = tenantId;
    }
}
