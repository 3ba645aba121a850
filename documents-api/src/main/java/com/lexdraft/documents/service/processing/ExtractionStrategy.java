package com.lexdraft.documents.service.processing;

public enum ExtractionStrategy {
    PLAIN_TEXT,
    PDF_TEXT,
    OCR,
    DOCX_TEXT,
    /** Mime types the pipeline does not know; yields empty text rather than an error. */
    UNSUPPORTED_EMPTY
}
