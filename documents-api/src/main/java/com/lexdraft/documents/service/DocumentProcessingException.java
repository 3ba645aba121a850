package com.lexdraft.documents.service;

import org.springframework.http.HttpStatus;

public class DocumentProcessingException extends RuntimeException {

    private final HttpStatus status;

    public DocumentProcessingException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public DocumentProcessingException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
