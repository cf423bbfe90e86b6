package io.backbork.core;

public enum AuditEventType {
    QUEUE_ADD,
    QUEUE_REMOVE,
    SCHEDULE_CREATE,
    SCHEDULE_UPDATE,
    SCHEDULE_DELETE,
    SCHEDULE_QUEUED,
    CANCEL_REQUEST,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_CANCELLED,
    PRUNE,
    PRUNE_SKIPPED
}
