package org.docstore.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 文档目录实体类
 * 每个知识库内的一个 Markdown 文件对应一行；contentHash 始终等于磁盘上该路径内容的 SHA-256。
 * 全文检索列 content_tsv 由数据库维护，不映射到实体。
 */
@Data
@Entity
@Table(name = "documents", uniqueConstraints = @UniqueConstraint(columnNames = {"vault_id", "path"}))
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "vault_id", nullable = false)
    private UUID vaultId;

    // 相对知识库根目录的路径，使用 '/' 分隔
    @Column(nullable = false, length = 1000)
    private String path;

    @Column(length = 500)
    private String title;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> frontmatter;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(columnDefinition = "text[]")
    private List<String> tags = new ArrayList<>();

    @Column(name = "stripped_content", columnDefinition = "text")
    private String strippedContent;

    @Column(name = "file_created_at")
    private OffsetDateTime fileCreatedAt;

    @Column(name = "file_modified_at", nullable = false)
    private OffsetDateTime fileModifiedAt;

    // 时间戳由 DocumentService 按注入的 Clock 写入
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
