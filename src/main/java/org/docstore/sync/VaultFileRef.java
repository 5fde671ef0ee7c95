package org.docstore.sync;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

// 数据目录下某个文件对应的 (用户, 知识库, 文档路径)
@Data
@AllArgsConstructor
public class VaultFileRef {
    private UUID userId;
    private String vaultSlug;
    private String docPath;
}
