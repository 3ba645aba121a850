package com.lexdraft.documents.service.integrity;

/**
 * Chain-of-custody record asserting who uploaded which bytes and when. The {@code signature} is the
 * SHA-256 of the canonical JSON form of every other field.
 */
public record EvidenceRecord(String fileHash,
                             String fileName,
                             long fileSize,
                             String uploaderId,
                             String timestamp,
                             String signature) {
}
