package org.docstore.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Markdown 内容解析结果
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ExtractedContent {
    private Map<String, Object> frontmatter; // YAML 头部，解析失败时为空 Map
    private String body;                     // 去掉头部后的正文
    private String title;
    private List<String> tags;               // 小写、去重、排序
    private String strippedContent;          // 去除 Markdown 语法后的纯文本，用于全文检索
}
