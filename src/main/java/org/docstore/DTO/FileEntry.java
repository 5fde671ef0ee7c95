package org.docstore.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// 目录遍历得到的一项
@Data
@AllArgsConstructor
@NoArgsConstructor
public class FileEntry {
    private String name;        // 文件或目录名
    private String path;        // 相对知识库根目录的路径
    private boolean directory;  // 是否为目录
    private long size;          // 文件字节数，目录为 0
    private Instant modifiedAt; // 最后修改时间
}
