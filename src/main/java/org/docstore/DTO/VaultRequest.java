package org.docstore.DTO;

import lombok.Data;

// 创建/更新知识库的请求体；更新时字段为空表示不修改
@Data
public class VaultRequest {
    private String name;
    private String description;
    private String baseDir; // 空字符串表示清除
}
