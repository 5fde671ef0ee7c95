package org.docstore.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

// 知识库实体类，对应数据库中的 'vaults' 表；磁盘目录为 dataDir/userId/slug
@Data
@Entity
@Table(name = "vaults", uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "slug"}))
public class Vault {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false, length = 100)
    private String name;

    // 创建后不再变化，避免磁盘路径失效
    @Column(nullable = false, length = 100)
    private String slug;

    @Column(columnDefinition = "text")
    private String description;

    // 可选：只对外暴露该子目录下的内容
    @Column(name = "base_dir", length = 1000)
    private String baseDir;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
