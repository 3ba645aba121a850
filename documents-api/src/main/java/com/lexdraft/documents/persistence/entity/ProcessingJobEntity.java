package com.lexdraft.documents.persistence.entity;

import com.lexdraft.documents.model.JobStatus;
import com.lexdraft.documents.model.JobType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "processing_jobs")
public class ProcessingJobEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "document_id", nullable = false, length = 64)
    private String documentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 32)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    @Column(name = "progress", nullable = false)
    private int progress;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "result_json", columnDefinition = "text")
    private String resultJson;

    @Column(name = "error", columnDefinition = "text")
    private String error;

    protected ProcessingJobEntity() {
    }

    public ProcessingJobEntity(String id, String documentId, JobType jobType, OffsetDateTime startedAt) {
        this.id = id;
        this.documentId = documentId;
        this.jobType = jobType;
        this.startedAt = startedAt;
        this.status = JobStatus.PROCESSING;
        this.progress = 0;
    }

    public void complete(String resultJson, OffsetDateTime completedAt) {
        transitionTo(JobStatus.COMPLETED);
        this.progress = 100;
        this.resultJson = resultJson;
        this.completedAt = completedAt;
    }

    public void fail(String error, OffsetDateTime completedAt) {
        transitionTo(JobStatus.FAILED);
        this.error = error == null || error.isBlank() ? "Unknown error" : error;
        this.completedAt = completedAt;
    }

    /**
     * A PROCESSING copy of this job with the same id, document, type and start time. Used to record a
     * different outcome when writing this job's terminal state was rolled back.
     */
    public ProcessingJobEntity asProcessing() {
        return new ProcessingJobEntity(id, documentId, jobType, startedAt);
    }

    private void transitionTo(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    public String getId() {
        return id;
    }

    public String getDocumentId() {
        return documentId;
    }

    public JobType getJobType() {
        return jobType;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public String getResultJson() {
        return resultJson;
    }

    public String getError() {
        return error;
    }
}
