package com.lexdraft.documents.service.upload;

import com.lexdraft.documents.model.CompleteUploadResponse;
import com.lexdraft.documents.persistence.entity.DocumentEntity;
import com.lexdraft.documents.persistence.repository.DocumentRepository;
import com.lexdraft.documents.service.DocumentProcessingException;
import com.lexdraft.documents.service.audit.AuditActions;
import com.lexdraft.documents.service.audit.AuditEvent;
import com.lexdraft.documents.service.audit.AuditSink;
import com.lexdraft.documents.service.integrity.EvidenceRecord;
import com.lexdraft.documents.service.integrity.IntegrityService;
import com.lexdraft.documents.service.processing.DocumentNotFoundException;
import com.lexdraft.documents.service.processing.DocumentProcessingService;
import com.lexdraft.documents.service.storage.DocumentStorage;
import com.lexdraft.documents.service.storage.StoredObjectMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a finished object-store upload into a PENDING document. The content hash and evidence record
 * are computed here, once, from the stored bytes.
 */
@Service
public class UploadCompletionService {

    private static final Logger log = LoggerFactory.getLogger(UploadCompletionService.class);

    private final DocumentStorage documentStorage;
    private final DocumentRepository documentRepository;
    private final IntegrityService integrityService;
    private final DocumentProcessingService processingService;
    private final AuditSink auditSink;

    public UploadCompletionService(DocumentStorage documentStorage,
                                   DocumentRepository documentRepository,
                                   IntegrityService integrityService,
                                   DocumentProcessingService processingService,
                                   AuditSink auditSink) {
        this.documentStorage = documentStorage;
        this.documentRepository = documentRepository;
        this.integrityService = integrityService;
        this.processingService = processingService;
        this.auditSink = auditSink;
    }

    public CompleteUploadResponse completeUpload(CompleteUploadCommand command) {
        if (!documentStorage.exists(command.storageKey())) {
            throw new DocumentProcessingException(HttpStatus.BAD_REQUEST, "File not found in storage. Upload may have failed.");
        }
        StoredObjectMetadata stored = documentStorage.getMetadata(command.storageKey());
        byte[] bytes = documentStorage.get(command.storageKey());
        if (stored.contentLength() != bytes.length || command.fileSize() != bytes.length) {
            log.warn("Size mismatch for {}: declared={} stored={} read={}",
                    command.storageKey(), command.fileSize(), stored.contentLength(), bytes.length);
        }

        String fileHash = integrityService.hash(bytes);
        if (command.declaredHash() != null && !command.declaredHash().isBlank()
                && !integrityService.verify(bytes, command.declaredHash())) {
            throw new DocumentProcessingException(HttpStatus.BAD_REQUEST, "Uploaded file does not match the declared hash");
        }

        Instant uploadedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        EvidenceRecord evidence = integrityService.buildEvidenceRecord(
                fileHash, command.fileName(), bytes.length, command.uploaderId(), uploadedAt);

        DocumentEntity document = new DocumentEntity(
                UUID.randomUUID().toString(),
                command.fileName(),
                command.mimeType(),
                bytes.length,
                command.storageKey(),
                fileHash,
                command.uploaderId()
        );
        document.attachEvidence(uploadedAt.atOffset(ZoneOffset.UTC), evidence.signature());
        DocumentEntity saved = documentRepository.save(document);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fileName", command.fileName());
        metadata.put("fileSize", bytes.length);
        metadata.put("fileHash", fileHash);
        metadata.put("signature", evidence.signature());
        auditSink.emit(AuditEvent.document(AuditActions.DOCUMENT_UPLOAD, saved.getId(), command.uploaderId(), metadata));
        log.info("Upload completed document={} uploader={} key={} hash={}", saved.getId(), command.uploaderId(), command.storageKey(), fileHash);

        processingService.processDocumentAsync(saved.getId());
        return new CompleteUploadResponse(saved.getId(), saved.getStatus(), evidence);
    }

    /**
     * Re-reads the stored bytes and checks them, and the evidence signature, against what was recorded
     * at upload time.
     */
    public DocumentIntegrityReport verifyIntegrity(String documentId) {
        DocumentEntity document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Document not found: " + documentId));
        byte[] bytes = documentStorage.get(document.getStorageKey());
        String actualHash = integrityService.hash(bytes);
        boolean hashMatches = actualHash.equals(document.getFileHash());
        boolean evidenceValid = evidenceValid(document);
        if (!hashMatches || !evidenceValid) {
            log.warn("Integrity check failed for document {} hashMatches={} evidenceValid={}", documentId, hashMatches, evidenceValid);
        }
        return new DocumentIntegrityReport(documentId, document.getFileHash(), actualHash, hashMatches, evidenceValid);
    }

    private boolean evidenceValid(DocumentEntity document) {
        if (document.getEvidenceTimestamp() == null || document.getEvidenceSignature() == null) {
            return false;
        }
        EvidenceRecord recorded = new EvidenceRecord(
                document.getFileHash(),
                document.getFileName(),
                document.getFileSize(),
                document.getUploadedBy(),
                integrityService.formatTimestamp(document.getEvidenceTimestamp().toInstant()),
                document.getEvidenceSignature());
        return integrityService.verifyEvidenceRecord(recorded);
    }
}
