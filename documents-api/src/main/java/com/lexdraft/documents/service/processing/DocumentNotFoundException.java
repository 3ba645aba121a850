package com.lexdraft.documents.service.processing;

import com.lexdraft.documents.service.DocumentProcessingException;
import org.springframework.http.HttpStatus;

/**
 * The document record, or the bytes it points at, could not be found. Never retried by the pipeline.
 */
public class DocumentNotFoundException extends DocumentProcessingException {

    public DocumentNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }

    public DocumentNotFoundException(String message, Throwable cause) {
        super(HttpStatus.NOT_FOUND, message, cause);
    }
}
