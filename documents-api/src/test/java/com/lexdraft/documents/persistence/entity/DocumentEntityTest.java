package com.lexdraft.documents.persistence.entity;

import com.lexdraft.documents.model.DocumentStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentEntityTest {

    @Test
    void textIsPresentOnlyWhileCompleted() {
        DocumentEntity document = new DocumentEntity("doc-1", "brief.txt", "text/plain", 5, "k", "h", "user-1");
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.PENDING);

        document.markProcessing();
        document.markCompleted("Hello");
        assertThat(document.getExtractedText()).isEqualTo("Hello");

        document.markProcessing();
        assertThat(document.getExtractedText()).isNull();

        document.markFailed();
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.FAILED);
        assertThat(document.getExtractedText()).isNull();
    }

    @Test
    void completionRequiresText() {
        DocumentEntity document = new DocumentEntity("doc-1", "brief.txt", "text/plain", 5, "k", "h", "user-1");

        assertThatThrownBy(() -> document.markCompleted(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
