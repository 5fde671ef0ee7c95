package org.docstore.DTO;

import lombok.Data;
import org.docstore.entity.Vault;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
public class VaultDTO {
    private UUID id;
    private String name;
    private String slug;
    private String description;
    private String baseDir;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static VaultDTO from(Vault vault) {
        VaultDTO dto = new VaultDTO();
        dto.setId(vault.getId());
        dto.setName(vault.getName());
        dto.setSlug(vault.getSlug());
        dto.setDescription(vault.getDescription());
        dto.setBaseDir(vault.getBaseDir());
        dto.setCreatedAt(vault.getCreatedAt());
        dto.setUpdatedAt(vault.getUpdatedAt());
        return dto;
    }
}
