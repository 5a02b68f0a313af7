package com.cpi.async.domain;

/**
 * Lifecycle of one submitted calculation task.
 */
public enum TaskState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
