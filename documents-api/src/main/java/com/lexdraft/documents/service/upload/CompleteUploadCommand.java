package com.lexdraft.documents.service.upload;

public record CompleteUploadCommand(String fileName,
                                    long fileSize,
                                    String mimeType,
                                    String storageKey,
                                    String declaredHash,
                                    String uploaderId) {
}
