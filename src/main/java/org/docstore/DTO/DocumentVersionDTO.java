package org.docstore.DTO;

import lombok.Data;
import org.docstore.entity.DocumentVersion;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
public class DocumentVersionDTO {
    private int versionNum;
    private String contentHash;
    private long sizeBytes;
    private String changeSource; // web / api / webdav
    private UUID changedBy;
    private OffsetDateTime createdAt;

    public static DocumentVersionDTO from(DocumentVersion version) {
        DocumentVersionDTO dto = new DocumentVersionDTO();
        dto.setVersionNum(version.getVersionNum());
        dto.setContentHash(version.getContentHash());
        dto.setSizeBytes(version.getSizeBytes());
        dto.setChangeSource(version.getChangeSource() == null ? null : version.getChangeSource().value());
        dto.setChangedBy(version.getChangedBy());
        dto.setCreatedAt(version.getCreatedAt());
        return dto;
    }
}
