package com.edusync.sync.reconcile.model;

public enum SyncOutcome {
    CREATED,
    UPDATED,
    UNCHANGED,
    FAILED
}
