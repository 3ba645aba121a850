package com.lexdraft.documents.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexdraft.documents.persistence.entity.AuditLogEntity;
import com.lexdraft.documents.persistence.repository.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaAuditSinkTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    private JpaAuditSink sink;

    @BeforeEach
    void setUp() {
        sink = new JpaAuditSink(auditLogRepository, new ObjectMapper());
    }

    @Test
    void persistsEventWithJsonMetadata() {
        AuditEvent event = AuditEvent.document(AuditActions.DOCUMENT_UPLOAD, "doc-1", "user-1", Map.of("fileName", "brief.pdf"));

        sink.emit(event);

        ArgumentCaptor<AuditLogEntity> captor = ArgumentCaptor.forClass(AuditLogEntity.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLogEntity entity = captor.getValue();
        assertThat(entity.getAction()).isEqualTo("document.upload");
        assertThat(entity.getResource()).isEqualTo("document");
        assertThat(entity.getResourceId()).isEqualTo("doc-1");
        assertThat(entity.getUserId()).isEqualTo("user-1");
        assertThat(entity.getMetadataJson()).isEqualTo("{\"fileName\":\"brief.pdf\"}");
    }

    @Test
    void persistenceFailureIsContained() {
        when(auditLogRepository.save(any(AuditLogEntity.class))).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> sink.emit(AuditEvent.document(AuditActions.PROCESS_FAILED, "doc-1", null, null)))
                .doesNotThrowAnyException();
    }
}
