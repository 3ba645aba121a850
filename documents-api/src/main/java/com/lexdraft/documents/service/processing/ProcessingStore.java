package com.lexdraft.documents.service.processing;

import com.lexdraft.documents.model.JobType;
import com.lexdraft.documents.persistence.entity.DocumentEntity;
import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface ProcessingStore {

    Optional<DocumentEntity> findDocument(String documentId);

    ProcessingJobEntity createJob(String documentId, JobType jobType, OffsetDateTime startedAt);

    ProcessingJobEntity updateJob(ProcessingJobEntity job);

    DocumentEntity updateDocument(DocumentEntity document);
}
