package com.lexdraft.documents.service.processing;

import com.lexdraft.documents.model.JobType;
import com.lexdraft.documents.persistence.entity.DocumentEntity;
import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

class InMemoryProcessingStore implements ProcessingStore {

    private final Map<String, DocumentEntity> documents = new LinkedHashMap<>();
    private final Map<String, ProcessingJobEntity> jobs = new LinkedHashMap<>();
    private final List<String> jobWrites = new ArrayList<>();

    void save(DocumentEntity document) {
        documents.put(document.getId(), document);
    }

    DocumentEntity document(String documentId) {
        return documents.get(documentId);
    }

    List<ProcessingJobEntity> jobsFor(String documentId) {
        return jobs.values().stream()
                .filter(job -> job.getDocumentId().equals(documentId))
                .collect(Collectors.toList());
    }

    List<String> jobWrites() {
        return jobWrites;
    }

    @Override
    public Optional<DocumentEntity> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public ProcessingJobEntity createJob(String documentId, JobType jobType, OffsetDateTime startedAt) {
        ProcessingJobEntity job = new ProcessingJobEntity("job-" + (jobs.size() + 1), documentId, jobType, startedAt);
        jobs.put(job.getId(), job);
        jobWrites.add(job.getId() + ":" + job.getStatus());
        return job;
    }

    @Override
    public ProcessingJobEntity updateJob(ProcessingJobEntity job) {
        jobs.put(job.getId(), job);
        jobWrites.add(job.getId() + ":" + job.getStatus());
        return job;
    }

    @Override
    public DocumentEntity updateDocument(DocumentEntity document) {
        documents.put(document.getId(), document);
        return document;
    }
}
