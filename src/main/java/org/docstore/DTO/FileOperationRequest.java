package org.docstore.DTO;

import lombok.Data;

// 移动/复制请求体；创建目录时只用 destination
@Data
public class FileOperationRequest {
    private String source;
    private String destination;
    private boolean overwrite;
}
