package com.lexdraft.documents.controller;

import com.lexdraft.documents.model.JobStatus;
import com.lexdraft.documents.model.JobType;
import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;
import com.lexdraft.documents.persistence.repository.ProcessingJobRepository;
import com.lexdraft.documents.service.processing.DocumentNotFoundException;
import com.lexdraft.documents.service.processing.DocumentProcessingService;
import com.lexdraft.documents.service.upload.UploadCompletionService;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DocumentControllerReactiveTest {

    private final UploadCompletionService uploadCompletionService = mock(UploadCompletionService.class);
    private final DocumentProcessingService processingService = mock(DocumentProcessingService.class);
    private final ProcessingJobRepository jobRepository = mock(ProcessingJobRepository.class);
    private final DocumentController controller = new DocumentController(uploadCompletionService, processingService, jobRepository);

    @Test
    void jobsStreamOneViewPerJob() {
        OffsetDateTime started = OffsetDateTime.parse("2024-05-01T10:15:30Z");
        ProcessingJobEntity running = new ProcessingJobEntity("job-2", "doc-1", JobType.TEXT_EXTRACTION, started.plusMinutes(1));
        ProcessingJobEntity done = new ProcessingJobEntity("job-1", "doc-1", JobType.TEXT_EXTRACTION, started);
        done.complete("{\"textLength\":0,\"strategy\":\"UNSUPPORTED_EMPTY\"}", started.plusSeconds(1));
        when(jobRepository.findByDocumentIdOrderByStartedAtDesc("doc-1")).thenReturn(List.of(running, done));

        StepVerifier.create(controller.jobs("doc-1"))
                .expectNextMatches(view -> view.jobId().equals("job-2") && view.status() == JobStatus.PROCESSING && view.progress() == 0)
                .expectNextMatches(view -> view.jobId().equals("job-1") && view.status() == JobStatus.COMPLETED)
                .verifyComplete();
    }

    @Test
    void documentWithoutJobsCompletesEmpty() {
        when(jobRepository.findByDocumentIdOrderByStartedAtDesc("doc-1")).thenReturn(List.of());

        StepVerifier.create(controller.jobs("doc-1")).verifyComplete();
    }

    @Test
    void integrityErrorsSurfaceThroughTheMono() {
        when(uploadCompletionService.verifyIntegrity("missing")).thenThrow(new DocumentNotFoundException("Document not found: missing"));

        StepVerifier.create(controller.integrity("missing"))
                .expectError(DocumentNotFoundException.class)
                .verify();
    }
}
