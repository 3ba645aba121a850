package com.lexdraft.documents.service.extraction;

import com.lexdraft.documents.service.DocumentProcessingException;
import org.springframework.http.HttpStatus;

public class ExtractionException extends DocumentProcessingException {

    public ExtractionException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
