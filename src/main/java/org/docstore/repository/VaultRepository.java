package org.docstore.repository;

import org.docstore.entity.Vault;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VaultRepository extends JpaRepository<Vault, UUID> {

    // 同时校验归属，不属于该用户的知识库按不存在处理
    Optional<Vault> findByIdAndUserId(UUID id, UUID userId);

    Optional<Vault> findByUserIdAndSlug(UUID userId, String slug);

    List<Vault> findByUserIdOrderByNameAsc(UUID userId);

    boolean existsByUserIdAndSlug(UUID userId, String slug);
}
