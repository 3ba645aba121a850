package com.lexdraft.documents.service.storage;

import org.springframework.http.HttpStatus;

public class StorageObjectNotFoundException extends StorageException {

    private final String key;

    public StorageObjectNotFoundException(String key, Throwable cause) {
        super(HttpStatus.NOT_FOUND, "Object not found in storage: " + key, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
