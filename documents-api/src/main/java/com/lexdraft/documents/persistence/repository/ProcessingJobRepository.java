package com.lexdraft.documents.persistence.repository;

import com.lexdraft.documents.persistence.entity.ProcessingJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProcessingJobRepository extends JpaRepository<ProcessingJobEntity, String> {

    List<ProcessingJobEntity> findByDocumentIdOrderByStartedAtDesc(String documentId);
}
