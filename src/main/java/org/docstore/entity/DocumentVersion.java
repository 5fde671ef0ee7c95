package org.docstore.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 文档版本记录，只追加不修改；仅保存哈希与大小，不保存历史内容
 */
@Data
@Entity
@Table(name = "document_versions",
        uniqueConstraints = @UniqueConstraint(columnNames = {"document_id", "version_num"}))
public class DocumentVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @Column(name = "version_num", nullable = false, updatable = false)
    private int versionNum;

    @Column(name = "content_hash", nullable = false, length = 64, updatable = false)
    private String contentHash;

    @Column(name = "size_bytes", nullable = false, updatable = false)
    private long sizeBytes;

    @Convert(converter = ChangeSource.Converter.class)
    @Column(name = "change_source", nullable = false, length = 20, updatable = false)
    private ChangeSource changeSource;

    // 操作用户，未知时为空
    @Column(name = "changed_by", updatable = false)
    private UUID changedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
