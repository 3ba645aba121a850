package com.lexdraft.documents.service.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Instant;
import java.util.Map;

@Component
public class S3DocumentStorage implements DocumentStorage {

    private static final Logger log = LoggerFactory.getLogger(S3DocumentStorage.class);

    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucket;

    public S3DocumentStorage(S3Client s3Client,
                             @Value("${documents.storage.bucket:lexdraft-documents}") String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public byte[] get(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
            log.debug("Downloaded {} bytes from s3://{}/{}", response.asByteArray().length, bucket, key);
            return response.asByteArray();
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException(key, e);
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                throw new StorageObjectNotFoundException(key, e);
            }
            log.error("Failed to download s3://{}/{}", bucket, key, e);
            throw new StorageException("Failed to download object " + key, e);
        } catch (SdkException e) {
            log.error("Failed to download s3://{}/{}", bucket, key, e);
            throw new StorageException("Failed to download object " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            head(key);
            return true;
        } catch (StorageObjectNotFoundException e) {
            return false;
        }
    }

    @Override
    public StoredObjectMetadata getMetadata(String key) {
        HeadObjectResponse response = head(key);
        return new StoredObjectMetadata(
                response.contentType() == null ? "application/octet-stream" : response.contentType(),
                response.contentLength() == null ? 0L : response.contentLength(),
                response.lastModified() == null ? Instant.now() : response.lastModified(),
                response.hasMetadata() ? Map.copyOf(response.metadata()) : Map.of()
        );
    }

    private HeadObjectResponse head(String key) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            return s3Client.headObject(request);
        } catch (NoSuchKeyException e) {
            throw new StorageObjectNotFoundException(key, e);
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                throw new StorageObjectNotFoundException(key, e);
            }
            log.error("Failed to read metadata for s3://{}/{}", bucket, key, e);
            throw new StorageException("Failed to read metadata for object " + key, e);
        } catch (SdkException e) {
            log.error("Failed to read metadata for s3://{}/{}", bucket, key, e);
            throw new StorageException("Failed to read metadata for object " + key, e);
        }
    }
}
