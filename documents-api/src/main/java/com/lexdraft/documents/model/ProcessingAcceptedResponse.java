package com.lexdraft.documents.model;

public record ProcessingAcceptedResponse(String documentId, String status) {

    public static ProcessingAcceptedResponse accepted(String documentId) {
        return new ProcessingAcceptedResponse(documentId, "ACCEPTED");
    }
}
