package com.lexdraft.documents.model;

/**
 * Lifecycle of a single processing job. A job starts in {@link #PROCESSING} and ends in exactly one
 * terminal state; it is never resumed.
 */
public enum JobStatus {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    public boolean canTransitionTo(JobStatus target) {
        return this == PROCESSING && target != null && target.isTerminal();
    }
}
