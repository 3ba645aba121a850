package com.lexdraft.documents.service.processing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexdraft.documents.model.JobType;
import com.lexdraft.documents.persistence.entity.DocumentEntity;
import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;
import com.lexdraft.documents.service.audit.AuditActions;
import com.lexdraft.documents.service.audit.AuditEvent;
import com.lexdraft.documents.service.audit.AuditSink;
import com.lexdraft.documents.service.extraction.DocxTextExtractor;
import com.lexdraft.documents.service.extraction.PdfTextExtractor;
import com.lexdraft.documents.service.extraction.PlainTextExtractor;
import com.lexdraft.documents.service.ocr.OcrService;
import com.lexdraft.documents.service.storage.DocumentStorage;
import com.lexdraft.documents.service.storage.StorageObjectNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs text-extraction jobs: fetch, pick a strategy, extract, persist. Steps run strictly in sequence
 * within one job. Concurrent jobs on the same document are not coordinated; the last writer wins.
 */
@Service
public class DefaultDocumentProcessingService implements DocumentProcessingService {

    private static final Logger log = LoggerFactory.getLogger(DefaultDocumentProcessingService.class);

    private static final String NO_STRATEGY = "NONE";

    private final ProcessingStore processingStore;
    private final DocumentStorage documentStorage;
    private final PlainTextExtractor plainTextExtractor;
    private final PdfTextExtractor pdfTextExtractor;
    private final DocxTextExtractor docxTextExtractor;
    private final OcrService ocrService;
    private final AuditSink auditSink;
    private final TransactionOperations transactionOperations;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Timer processingTimer;
    private final Executor processingExecutor;

    public DefaultDocumentProcessingService(ProcessingStore processingStore,
                                            DocumentStorage documentStorage,
                                            PlainTextExtractor plainTextExtractor,
                                            PdfTextExtractor pdfTextExtractor,
                                            DocxTextExtractor docxTextExtractor,
                                            OcrService ocrService,
                                            AuditSink auditSink,
                                            TransactionOperations transactionOperations,
                                            ObjectMapper objectMapper,
                                            MeterRegistry meterRegistry,
                                            @Qualifier("documentProcessingExecutor") Executor processingExecutor) {
        this.processingStore = processingStore;
        this.documentStorage = documentStorage;
        this.plainTextExtractor = plainTextExtractor;
        this.pdfTextExtractor = pdfTextExtractor;
        this.docxTextExtractor = docxTextExtractor;
        this.ocrService = ocrService;
        this.auditSink = auditSink;
        this.transactionOperations = transactionOperations;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.processingTimer = meterRegistry.timer("documents.processing.duration");
        this.processingExecutor = processingExecutor;
    }

    @Override
    public String processDocument(String documentId) {
        DocumentEntity document = processingStore.findDocument(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Document not found: " + documentId));

        ProcessingJobEntity job = processingStore.createJob(document.getId(), JobType.TEXT_EXTRACTION, OffsetDateTime.now());
        document.markProcessing();
        document = processingStore.updateDocument(document);
        log.info("Processing document {} ({}) with job {}", document.getId(), document.getMimeType(), job.getId());

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Extraction extraction = runExtraction(document, job);
            recordSuccess(document, job, extraction.strategy(), extraction.text());
            return extraction.text();
        } finally {
            sample.stop(processingTimer);
        }
    }

    @Override
    public CompletableFuture<String> processDocumentAsync(String documentId) {
        return CompletableFuture.supplyAsync(() -> processDocument(documentId), processingExecutor)
                .whenComplete((text, error) -> {
                    if (error != null) {
                        log.warn("Background processing of document {} failed: {}", documentId, error.getMessage());
                    }
                });
    }

    private Extraction runExtraction(DocumentEntity document, ProcessingJobEntity job) {
        ExtractionStrategy strategy = null;
        try {
            byte[] bytes = fetch(document);
            strategy = selectStrategy(document, bytes);
            return new Extraction(strategy, extract(strategy, document, bytes));
        } catch (RuntimeException | Error ex) {
            recordFailure(document, job, strategy, ex);
            throw ex;
        }
    }

    private byte[] fetch(DocumentEntity document) {
        try {
            return documentStorage.get(document.getStorageKey());
        } catch (StorageObjectNotFoundException e) {
            throw new DocumentNotFoundException("Stored file not found for document " + document.getId(), e);
        }
    }

    ExtractionStrategy selectStrategy(DocumentEntity document, byte[] bytes) {
        String mimeType = document.getMimeType();
        if (pdfTextExtractor.supports(mimeType)) {
            if (pdfTextExtractor.isLikelyScanned(bytes)) {
                log.info("PDF {} appears to be scanned, using OCR", document.getId());
                return ExtractionStrategy.OCR;
            }
            return ExtractionStrategy.PDF_TEXT;
        }
        if (docxTextExtractor.supports(mimeType)) {
            return ExtractionStrategy.DOCX_TEXT;
        }
        if (plainTextExtractor.supports(mimeType)) {
            return ExtractionStrategy.PLAIN_TEXT;
        }
        log.info("No extractor for mime type {} on document {}, storing empty text", mimeType, document.getId());
        return ExtractionStrategy.UNSUPPORTED_EMPTY;
    }

    private String extract(ExtractionStrategy strategy, DocumentEntity document, byte[] bytes) {
        switch (strategy) {
            case OCR:
                return ocrService.extractWithFallback(bytes, document.getMimeType());
            case PDF_TEXT:
                return pdfTextExtractor.extract(bytes);
            case DOCX_TEXT:
                return docxTextExtractor.extract(bytes);
            case PLAIN_TEXT:
                return plainTextExtractor.extract(bytes);
            case UNSUPPORTED_EMPTY:
            default:
                return "";
        }
    }

    private void recordSuccess(DocumentEntity document,
                               ProcessingJobEntity job,
                               ExtractionStrategy strategy,
                               String text) {
        try {
            String resultJson = resultJson(text, strategy);
            transactionOperations.executeWithoutResult(status -> {
                document.markCompleted(text);
                job.complete(resultJson, OffsetDateTime.now());
                processingStore.updateDocument(document);
                processingStore.updateJob(job);
            });
        } catch (RuntimeException | Error writeFailure) {
            // the in-memory job may already be COMPLETED while its row still says PROCESSING
            recordFailure(document, job.asProcessing(), strategy, writeFailure);
            throw writeFailure;
        }
        meterRegistry.counter("documents.processing.events", "outcome", "completed", "strategy", strategy.name()).increment();
        log.info("Document {} processed with {} textLength={}", document.getId(), strategy, text.length());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("jobId", job.getId());
        metadata.put("strategy", strategy.name());
        metadata.put("textLength", text.length());
        emitQuietly(AuditEvent.document(AuditActions.PROCESS_COMPLETED, document.getId(), null, metadata));
    }

    private void recordFailure(DocumentEntity document,
                               ProcessingJobEntity job,
                               ExtractionStrategy strategy,
                               Throwable failure) {
        log.error("Processing of document {} failed in job {}", document.getId(), job.getId(), failure);
        try {
            transactionOperations.executeWithoutResult(status -> {
                document.markFailed();
                job.fail(failure.getMessage(), OffsetDateTime.now());
                processingStore.updateDocument(document);
                processingStore.updateJob(job);
            });
        } catch (RuntimeException persistenceFailure) {
            log.error("Failed to record failure of job {} for document {}", job.getId(), document.getId(), persistenceFailure);
            failure.addSuppressed(persistenceFailure);
        }
        String strategyTag = strategy == null ? NO_STRATEGY : strategy.name();
        meterRegistry.counter("documents.processing.events", "outcome", "failed", "strategy", strategyTag).increment();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("jobId", job.getId());
        metadata.put("strategy", strategyTag);
        metadata.put("error", String.valueOf(failure.getMessage()));
        emitQuietly(AuditEvent.document(AuditActions.PROCESS_FAILED, document.getId(), null, metadata));
    }

    private String resultJson(String text, ExtractionStrategy strategy) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("textLength", text.length());
        result.put("strategy", strategy.name());
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job result", e);
        }
    }

    private void emitQuietly(AuditEvent event) {
        try {
            auditSink.emit(event);
        } catch (RuntimeException e) {
            log.warn("Audit sink rejected event {} for document {}", event.action(), event.resourceId(), e);
        }
    }

    private record Extraction(ExtractionStrategy strategy, String text) {
    }
}
