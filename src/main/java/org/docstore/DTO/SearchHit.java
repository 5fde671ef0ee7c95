package org.docstore.DTO;

import lombok.Data;

import java.util.List;
import java.util.UUID;

// 单条全文检索结果
@Data
public class SearchHit {
    private UUID documentId;
    private UUID vaultId;
    private String vaultName;
    private String path;
    private String title;
    private List<String> tags;
    private String snippet; // ts_headline 生成的高亮片段
    private double rank;
}
