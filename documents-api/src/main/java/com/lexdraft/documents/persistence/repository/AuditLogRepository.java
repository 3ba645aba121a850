package com.lexdraft.documents.persistence.repository;

import com.lexdraft.documents.persistence.entity.AuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByResourceIdOrderByIdAsc(String resourceId);
}
