package com.lexdraft.documents.service.storage;

import com.lexdraft.documents.service.DocumentProcessingException;
import org.springframework.http.HttpStatus;

/**
 * Transient object-store failure. Callers may retry; the pipeline itself does not.
 */
public class StorageException extends DocumentProcessingException {

    public StorageException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
    }

    protected StorageException(HttpStatus status, String message, Throwable cause) {
        super(status, message, cause);
    }

    public boolean retryable() {
        return true;
    }
}
