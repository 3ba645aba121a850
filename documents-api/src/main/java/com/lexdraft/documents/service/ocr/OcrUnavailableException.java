package com.lexdraft.documents.service.ocr;

import com.lexdraft.documents.service.DocumentProcessingException;
import org.springframework.http.HttpStatus;

/**
 * Primary OCR failed and the fallback chain could not produce text. Kept distinct from
 * {@link com.lexdraft.documents.service.extraction.ExtractionException} so callers can tell a missing
 * OCR engine from a broken document.
 */
public class OcrUnavailableException extends DocumentProcessingException {

    public OcrUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
