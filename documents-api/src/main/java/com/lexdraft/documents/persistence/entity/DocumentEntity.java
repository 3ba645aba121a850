package com.lexdraft.documents.persistence.entity;

import com.lexdraft.documents.model.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

/**
 * One uploaded file. Upload facts (name, type, size, location, hash, evidence) are written once;
 * only {@code status} and {@code extractedText} change afterwards, and {@code extractedText} is set
 * exactly when the status is {@link DocumentStatus#COMPLETED}.
 */
@Entity
@Table(name = "documents")
public class DocumentEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "mime_type", nullable = false, length = 128)
    private String mimeType;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "storage_key", nullable = false, length = 1024)
    private String storageKey;

    @Column(name = "file_hash", nullable = false, length = 64)
    private String fileHash;

    @Column(name = "uploaded_by", length = 64)
    private String uploadedBy;

    @Column(name = "evidence_timestamp")
    private OffsetDateTime evidenceTimestamp;

    @Column(name = "evidence_signature", length = 64)
    private String evidenceSignature;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DocumentStatus status;

    @Column(name = "extracted_text", columnDefinition = "text")
    private String extractedText;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    protected DocumentEntity() {
    }

    public DocumentEntity(String id,
                          String fileName,
                          String mimeType,
                          long fileSize,
                          String storageKey,
                          String fileHash,
                          String uploadedBy) {
        this.id = id;
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.fileSize = fileSize;
        this.storageKey = storageKey;
        this.fileHash = fileHash;
        this.uploadedBy = uploadedBy;
        this.status = DocumentStatus.PENDING;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    public void markProcessing() {
        this.status = DocumentStatus.PROCESSING;
        this.extractedText = null;
    }

    public void markCompleted(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Completed documents require extracted text");
        }
        this.status = DocumentStatus.COMPLETED;
        this.extractedText = text;
    }

    public void markFailed() {
        this.status = DocumentStatus.FAILED;
        this.extractedText = null;
    }

    public void attachEvidence(OffsetDateTime timestamp, String signature) {
        this.evidenceTimestamp = timestamp;
        this.evidenceSignature = signature;
    }

    public String getId() {
        return id;
    }

    public String getFileName() {
        return fileName;
    }

    public String getMimeType() {
        return mimeType;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public String getFileHash() {
        return fileHash;
    }

    public String getUploadedBy() {
        return uploadedBy;
    }

    public OffsetDateTime getEvidenceTimestamp() {
        return evidenceTimestamp;
    }

    public String getEvidenceSignature() {
        return evidenceSignature;
    }

    public DocumentStatus getStatus() {
        return status;
    }

    public String getExtractedText() {
        return extractedText;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
