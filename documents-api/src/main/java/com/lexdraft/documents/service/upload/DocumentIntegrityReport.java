package com.lexdraft.documents.service.upload;

public record DocumentIntegrityReport(String documentId,
                                      String expectedHash,
                                      String actualHash,
                                      boolean hashMatches,
                                      boolean evidenceValid) {

    public boolean intact() {
        return hashMatches && evidenceValid;
    }
}
