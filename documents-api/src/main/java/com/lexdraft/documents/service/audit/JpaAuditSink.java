package com.lexdraft.documents.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexdraft.documents.persistence.entity.AuditLogEntity;
import com.lexdraft.documents.persistence.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JpaAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditSink.class);

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public JpaAuditSink(AuditLogRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public void emit(AuditEvent event) {
        log.info("DOCUMENT_AUDIT action={} resource={} resourceId={} user={} metadata={} timestamp={}"
                , event.action()
                , event.resource()
                , event.resourceId()
                , event.userId()
                , event.metadata()
                , event.occurredAt());
        try {
            auditLogRepository.save(new AuditLogEntity(
                    event.action(),
                    event.resource(),
                    event.resourceId(),
                    event.userId(),
                    toJson(event),
                    event.occurredAt()
            ));
        } catch (RuntimeException e) {
            log.error("Failed to persist audit event {} for {} {}", event.action(), event.resource(), event.resourceId(), e);
        }
    }

    private String toJson(AuditEvent event) {
        try {
            return objectMapper.writeValueAsString(event.metadata());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit metadata for {}", event.action(), e);
            return "{}";
        }
    }
}
