package com.lexdraft.documents.persistence.repository;

import com.lexdraft.documents.persistence.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {
}
