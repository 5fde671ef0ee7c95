package org.docstore.DTO;

import lombok.Data;
import org.docstore.entity.Document;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

// 文档元数据，对外返回；路径已转换为用户视角
@Data
public class DocumentDTO {
    private UUID id;
    private UUID vaultId;
    private String path;
    private String title;
    private String contentHash;
    private long sizeBytes;
    private Map<String, Object> frontmatter;
    private List<String> tags;
    private OffsetDateTime fileCreatedAt;
    private OffsetDateTime fileModifiedAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static DocumentDTO from(Document document, String userPath) {
        DocumentDTO dto = new DocumentDTO();
        dto.setId(document.getId());
        dto.setVaultId(document.getVaultId());
        dto.setPath(userPath);
        dto.setTitle(document.getTitle());
        dto.setContentHash(document.getContentHash());
        dto.setSizeBytes(document.getSizeBytes());
        dto.setFrontmatter(document.getFrontmatter());
        dto.setTags(document.getTags() == null ? new ArrayList<>() : new ArrayList<>(document.getTags()));
        dto.setFileCreatedAt(document.getFileCreatedAt());
        dto.setFileModifiedAt(document.getFileModifiedAt());
        dto.setCreatedAt(document.getCreatedAt());
        dto.setUpdatedAt(document.getUpdatedAt());
        return dto;
    }
}
