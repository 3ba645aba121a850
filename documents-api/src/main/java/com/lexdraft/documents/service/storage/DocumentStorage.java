package com.lexdraft.documents.service.storage;

/**
 * Object store holding uploaded document bytes. Missing objects raise
 * {@link StorageObjectNotFoundException}; every other failure raises a retryable
 * {@link StorageException}.
 */
public interface DocumentStorage {

    byte[] get(String key);

    boolean exists(String key);

    StoredObjectMetadata getMetadata(String key);
}
