package com.lexdraft.documents.controller;

import com.lexdraft.documents.model.CompleteUploadRequest;
import com.lexdraft.documents.model.CompleteUploadResponse;
import com.lexdraft.documents.model.DocumentStatus;
import com.lexdraft.documents.model.JobType;
import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;
import com.lexdraft.documents.persistence.repository.ProcessingJobRepository;
import com.lexdraft.documents.service.integrity.EvidenceRecord;
import com.lexdraft.documents.service.processing.DocumentNotFoundException;
import com.lexdraft.documents.service.processing.DocumentProcessingService;
import com.lexdraft.documents.service.upload.CompleteUploadCommand;
import com.lexdraft.documents.service.upload.DocumentIntegrityReport;
import com.lexdraft.documents.service.upload.UploadCompletionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = DocumentController.class)
class DocumentControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private UploadCompletionService uploadCompletionService;

    @MockBean
    private DocumentProcessingService processingService;

    @MockBean
    private ProcessingJobRepository jobRepository;

    @Test
    void completeUploadReturnsPendingDocumentAndEvidence() {
        EvidenceRecord evidence = new EvidenceRecord("abc", "brief.pdf", 2048, "user-1", "2024-05-01T10:15:30.000Z", "sig");
        when(uploadCompletionService.completeUpload(any()))
                .thenReturn(new CompleteUploadResponse("doc-1", DocumentStatus.PENDING, evidence));

        webTestClient.post()
                .uri("/internal/uploads/complete")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new CompleteUploadRequest("brief.pdf", 2048, "application/pdf", "uploads/brief.pdf", null, "user-1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.documentId").isEqualTo("doc-1")
                .jsonPath("$.status").isEqualTo("PENDING")
                .jsonPath("$.evidence.signature").isEqualTo("sig");

        ArgumentCaptor<CompleteUploadCommand> captor = ArgumentCaptor.forClass(CompleteUploadCommand.class);
        verify(uploadCompletionService).completeUpload(captor.capture());
        assertThat(captor.getValue().mimeType()).isEqualTo("application/pdf");
        assertThat(captor.getValue().storageKey()).isEqualTo("uploads/brief.pdf");
    }

    @Test
    void completeUploadValidatesRequest() {
        webTestClient.post()
                .uri("/internal/uploads/complete")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new CompleteUploadRequest("", 2048, "application/pdf", "uploads/brief.pdf", null, "user-1"))
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(uploadCompletionService);
    }

    @Test
    void processIsAcceptedAndRunsInBackground() {
        when(processingService.processDocumentAsync("doc-1")).thenReturn(new CompletableFuture<>());

        webTestClient.post()
                .uri("/internal/documents/doc-1/process")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.documentId").isEqualTo("doc-1")
                .jsonPath("$.status").isEqualTo("ACCEPTED");

        verify(processingService).processDocumentAsync("doc-1");
    }

    @Test
    void fullProcessingQueueIsServiceUnavailable() {
        when(processingService.processDocumentAsync("doc-1")).thenThrow(new TaskRejectedException("Executor did not accept task"));

        webTestClient.post()
                .uri("/internal/documents/doc-1/process")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Processing queue is full, retry later");
    }

    @Test
    void jobsAreListedNewestFirst() {
        OffsetDateTime started = OffsetDateTime.parse("2024-05-01T10:15:30Z");
        ProcessingJobEntity failed = new ProcessingJobEntity("job-1", "doc-1", JobType.TEXT_EXTRACTION, started);
        failed.fail("Stored file not found for document doc-1", started.plusSeconds(1));
        ProcessingJobEntity completed = new ProcessingJobEntity("job-2", "doc-1", JobType.TEXT_EXTRACTION, started.plusMinutes(5));
        completed.complete("{\"textLength\":5,\"strategy\":\"PLAIN_TEXT\"}", started.plusMinutes(6));
        when(jobRepository.findByDocumentIdOrderByStartedAtDesc("doc-1")).thenReturn(List.of(completed, failed));

        webTestClient.get()
                .uri("/internal/documents/doc-1/jobs")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].jobId").isEqualTo("job-2")
                .jsonPath("$[0].status").isEqualTo("COMPLETED")
                .jsonPath("$[0].progress").isEqualTo(100)
                .jsonPath("$[1].status").isEqualTo("FAILED")
                .jsonPath("$[1].error").isEqualTo("Stored file not found for document doc-1");
    }

    @Test
    void integrityReportIsReturned() {
        when(uploadCompletionService.verifyIntegrity("doc-1"))
                .thenReturn(new DocumentIntegrityReport("doc-1", "abc", "abd", false, true));

        webTestClient.get()
                .uri("/internal/documents/doc-1/integrity")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hashMatches").isEqualTo(false)
                .jsonPath("$.evidenceValid").isEqualTo(true);
    }

    @Test
    void missingDocumentMapsToNotFound() {
        when(uploadCompletionService.verifyIntegrity("missing"))
                .thenThrow(new DocumentNotFoundException("Document not found: missing"));

        webTestClient.get()
                .uri("/internal/documents/missing/integrity")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Document not found: missing");
    }
}
