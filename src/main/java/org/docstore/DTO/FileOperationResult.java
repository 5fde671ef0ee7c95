package org.docstore.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// 目录创建、移动、复制的返回结果
@Data
@AllArgsConstructor
@NoArgsConstructor
public class FileOperationResult {
    private String message;
    private String source;      // 创建目录时为空
    private String destination;
}
