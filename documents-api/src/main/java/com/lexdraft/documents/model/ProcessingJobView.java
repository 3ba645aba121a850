package com.lexdraft.documents.model;

import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;

import java.time.OffsetDateTime;

public record ProcessingJobView(String jobId,
                                String documentId,
                                JobType jobType,
                                JobStatus status,
                                int progress,
                                OffsetDateTime startedAt,
                                OffsetDateTime completedAt,
                                String result,
                                String error) {

    public static ProcessingJobView from(ProcessingJobEntity job) {
        return new ProcessingJobView(
                job.getId(),
                job.getDocumentId(),
                job.getJobType(),
                job.getStatus(),
                job.getProgress(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getResultJson(),
                job.getError()
        );
    }
}
