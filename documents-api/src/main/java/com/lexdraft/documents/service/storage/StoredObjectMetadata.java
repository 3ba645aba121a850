package com.lexdraft.documents.service.storage;

import java.time.Instant;
import java.util.Map;

public record StoredObjectMetadata(String contentType,
                                   long contentLength,
                                   Instant lastModified,
                                   Map<String, String> userMetadata) {
}
