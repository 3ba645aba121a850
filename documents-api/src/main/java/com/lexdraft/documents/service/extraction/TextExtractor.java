package com.lexdraft.documents.service.extraction;

/**
 * Turns the raw bytes of one document format into text. Parser failures surface as
 * {@link ExtractionException}.
 */
public interface TextExtractor {

    /**
     * Whether this extractor handles {@code mimeType}. Parameters and case are ignored.
     */
    boolean supports(String mimeType);

    String extract(byte[] bytes);
}
