package com.lexdraft.documents.service.processing;

import java.util.concurrent.CompletableFuture;

public interface DocumentProcessingService {

    /**
     * Runs one text-extraction job for the document and returns the extracted text. Any failure marks
     * the document and the job as failed and is rethrown; nothing is retried.
     */
    String processDocument(String documentId);

    CompletableFuture<String> processDocumentAsync(String documentId);
}
