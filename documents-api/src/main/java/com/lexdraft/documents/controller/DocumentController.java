package com.lexdraft.documents.controller;

import com.lexdraft.documents.model.CompleteUploadRequest;
import com.lexdraft.documents.model.CompleteUploadResponse;
import com.lexdraft.documents.model.ProcessingAcceptedResponse;
import com.lexdraft.documents.model.ProcessingJobView;
import com.lexdraft.documents.persistence.repository.ProcessingJobRepository;
import com.lexdraft.documents.service.processing.DocumentProcessingService;
import com.lexdraft.documents.service.upload.CompleteUploadCommand;
import com.lexdraft.documents.service.upload.DocumentIntegrityReport;
import com.lexdraft.documents.service.upload.UploadCompletionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Internal trigger surface for the upload service. Blocking work is moved off the event loop.
 */
@RestController
@RequestMapping("/internal")
@Validated
public class DocumentController {

    private final UploadCompletionService uploadCompletionService;
    private final DocumentProcessingService processingService;
    private final ProcessingJobRepository jobRepository;

    public DocumentController(UploadCompletionService uploadCompletionService,
                              DocumentProcessingService processingService,
                              ProcessingJobRepository jobRepository) {
        this.uploadCompletionService = uploadCompletionService;
        this.processingService = processingService;
        this.jobRepository = jobRepository;
    }

    @PostMapping(value = "/uploads/complete", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<CompleteUploadResponse> completeUpload(@Valid @RequestBody CompleteUploadRequest request) {
        CompleteUploadCommand command = new CompleteUploadCommand(
                request.fileName(),
                request.fileSize(),
                request.contentType(),
                request.storageKey(),
                request.fileHash(),
                request.uploaderId()
        );
        return Mono.fromCallable(() -> uploadCompletionService.completeUpload(command))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(value = "/documents/{documentId}/process", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ProcessingAcceptedResponse process(@PathVariable String documentId) {
        processingService.processDocumentAsync(documentId);
        return ProcessingAcceptedResponse.accepted(documentId);
    }

    @GetMapping(value = "/documents/{documentId}/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
    public Flux<ProcessingJobView> jobs(@PathVariable String documentId) {
        return Mono.fromCallable(() -> jobRepository.findByDocumentIdOrderByStartedAtDesc(documentId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(jobs -> jobs)
                .map(ProcessingJobView::from);
    }

    @GetMapping(value = "/documents/{documentId}/integrity", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DocumentIntegrityReport> integrity(@PathVariable String documentId) {
        return Mono.fromCallable(() -> uploadCompletionService.verifyIntegrity(documentId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
