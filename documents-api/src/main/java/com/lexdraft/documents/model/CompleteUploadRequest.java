package com.lexdraft.documents.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record CompleteUploadRequest(@NotBlank String fileName,
                                    @Positive long fileSize,
                                    @NotBlank String contentType,
                                    @NotBlank String storageKey,
                                    String fileHash,
                                    @NotBlank String uploaderId) {
}
