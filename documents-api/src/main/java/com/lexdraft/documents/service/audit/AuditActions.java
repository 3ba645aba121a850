package com.lexdraft.documents.service.audit;

public final class AuditActions {

    public static final String DOCUMENT_UPLOAD = "document.upload";
    public static final String PROCESS_COMPLETED = "document.process.completed";
    public static final String PROCESS_FAILED = "document.process.failed";

    public static final String RESOURCE_DOCUMENT = "document";

    private AuditActions() {
    }
}
