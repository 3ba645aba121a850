package com.lexdraft.documents.service.processing;

import com.lexdraft.documents.model.JobType;
import com.lexdraft.documents.persistence.entity.DocumentEntity;
import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;
import com.lexdraft.documents.persistence.repository.DocumentRepository;
import com.lexdraft.documents.persistence.repository.ProcessingJobRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Component
@Transactional
public class JpaProcessingStore implements ProcessingStore {

    private final DocumentRepository documentRepository;
    private final ProcessingJobRepository jobRepository;

    public JpaProcessingStore(DocumentRepository documentRepository, ProcessingJobRepository jobRepository) {
        this.documentRepository = documentRepository;
        this.jobRepository = jobRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DocumentEntity> findDocument(String documentId) {
        return documentRepository.findById(documentId);
    }

    @Override
    public ProcessingJobEntity createJob(String documentId, JobType jobType, OffsetDateTime startedAt) {
        return jobRepository.save(new ProcessingJobEntity(UUID.randomUUID().toString(), documentId, jobType, startedAt));
    }

    @Override
    public ProcessingJobEntity updateJob(ProcessingJobEntity job) {
        return jobRepository.save(job);
    }

    @Override
    public DocumentEntity updateDocument(DocumentEntity document) {
        return documentRepository.save(document);
    }
}
