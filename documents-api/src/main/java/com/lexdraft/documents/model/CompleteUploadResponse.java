package com.lexdraft.documents.model;

import com.lexdraft.documents.service.integrity.EvidenceRecord;

public record CompleteUploadResponse(String documentId,
                                     DocumentStatus status,
                                     EvidenceRecord evidence) {
}
