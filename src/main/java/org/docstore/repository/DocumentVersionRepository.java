package org.docstore.repository;

import org.docstore.entity.DocumentVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentVersionRepository extends JpaRepository<DocumentVersion, UUID> {

    Optional<DocumentVersion> findTopByDocumentIdOrderByVersionNumDesc(UUID documentId);

    List<DocumentVersion> findByDocumentIdOrderByVersionNumDesc(UUID documentId);
}
