package com.lexdraft.documents.service.audit;

import java.time.OffsetDateTime;
import java.util.Map;

public record AuditEvent(String action,
                         String resource,
                         String resourceId,
                         String userId,
                         Map<String, Object> metadata,
                         OffsetDateTime occurredAt) {

    public static AuditEvent document(String action, String documentId, String userId, Map<String, Object> metadata) {
        return new AuditEvent(action, AuditActions.RESOURCE_DOCUMENT, documentId, userId,
                metadata == null ? Map.of() : metadata, OffsetDateTime.now());
    }
}
