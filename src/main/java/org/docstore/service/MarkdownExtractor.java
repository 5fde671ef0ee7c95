package org.docstore.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.docstore.DTO.ExtractedContent;
import org.docstore.utils.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown 内容解析服务
 * 从文档内容中提取 YAML 头部、标题、标签，以及用于全文检索的纯文本。
 * 无状态，不访问磁盘和数据库。
 */
@Service
public class MarkdownExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownExtractor.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    // 头部起始行为 ---，到下一行单独的 --- 结束
    private static final Pattern FRONTMATTER = Pattern.compile("\\A---[ \\t]*\\r?\\n(.*?)(?:\\r?\\n)?^---[ \\t]*(?:\\r?\\n|\\z)",
            Pattern.DOTALL | Pattern.MULTILINE);
    private static final Pattern H1 = Pattern.compile("^#\\s+(.+)$", Pattern.MULTILINE);
    private static final Pattern INLINE_TAG = Pattern.compile("(?:^|\\s)#([a-zA-Z][\\w-]*)");
    private static final Pattern FENCED_CODE = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]*)`");

    private static final List<Replacement> STRIP_RULES = List.of(
            new Replacement("```[\\s\\S]*?```", ""),
            new Replacement("`([^`]*)`", "$1"),
            // 图片、链接只保留文字
            new Replacement("!\\[([^\\]]*)\\]\\([^)]*\\)", "$1"),
            new Replacement("\\[([^\\]]*)\\]\\([^)]*\\)", "$1"),
            new Replacement("\\[([^\\]]*)\\]\\[[^\\]]*\\]", "$1"),
            new Replacement("(?m)^#{1,6}\\s+", ""),
            new Replacement("\\*\\*\\*(.+?)\\*\\*\\*", "$1"),
            new Replacement("\\*\\*(.+?)\\*\\*", "$1"),
            new Replacement("\\*(.+?)\\*", "$1"),
            new Replacement("___(.+?)___", "$1"),
            new Replacement("__(.+?)__", "$1"),
            new Replacement("_(.+?)_", "$1"),
            new Replacement("~~(.+?)~~", "$1"),
            new Replacement("(?m)^[-*_]{3,}\\s*$", ""),
            new Replacement("(?m)^>\\s?", ""),
            new Replacement("(?m)^\\s*[-+*]\\s+", ""),
            new Replacement("(?m)^\\s*\\d+\\.\\s+", ""),
            new Replacement("<[^>]*>", ""),
            new Replacement("\\n{3,}", "\n\n")
    );

    public ExtractedContent extract(String content, String fileName) {
        Map<String, Object> frontmatter = new LinkedHashMap<>();
        String body = content;

        Matcher matcher = FRONTMATTER.matcher(content);
        if (matcher.find()) {
            Map<String, Object> parsed = parseYaml(matcher.group(1), fileName);
            if (parsed != null) {
                frontmatter = parsed;
                body = content.substring(matcher.end());
            }
        }

        return new ExtractedContent(
                frontmatter,
                body,
                extractTitle(frontmatter, body, fileName),
                extractTags(frontmatter, body),
                stripMarkdown(body));
    }

    /**
     * 标题优先级：头部 title -> 第一个一级标题 -> 文件名（去掉 .md）
     */
    String extractTitle(Map<String, Object> frontmatter, String body, String fileName) {
        Object title = frontmatter.get("title");
        if (title instanceof String && !((String) title).isBlank()) {
            return ((String) title).trim();
        }
        Matcher h1 = H1.matcher(body);
        if (h1.find()) {
            return h1.group(1).trim();
        }
        return baseName(fileName);
    }

    List<String> extractTags(Map<String, Object> frontmatter, String body) {
        TreeSet<String> tags = new TreeSet<>();

        Object declared = frontmatter.get("tags");
        if (declared instanceof Collection) {
            for (Object tag : (Collection<?>) declared) {
                if (tag instanceof String) {
                    addTag(tags, (String) tag);
                }
            }
        } else if (declared instanceof String) {
            for (String tag : ((String) declared).split(",")) {
                addTag(tags, tag);
            }
        }

        // 代码里的 #xxx 不算标签
        String withoutCode = INLINE_CODE.matcher(FENCED_CODE.matcher(body).replaceAll("")).replaceAll("");
        Matcher inline = INLINE_TAG.matcher(withoutCode);
        while (inline.find()) {
            addTag(tags, inline.group(1));
        }
        return new ArrayList<>(tags);
    }

    String stripMarkdown(String body) {
        String text = body;
        for (Replacement rule : STRIP_RULES) {
            text = rule.pattern.matcher(text).replaceAll(rule.replacement);
        }
        return text.trim();
    }

    private Map<String, Object> parseYaml(String yaml, String fileName) {
        if (yaml.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = YAML_MAPPER.readValue(yaml, MAP_TYPE);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (Exception e) {
            // 头部格式错误时整篇按正文处理
            logger.debug("文档头部解析失败，按无头部处理: {} ({})", fileName, e.getMessage());
            return null;
        }
    }

    private static void addTag(TreeSet<String> tags, String tag) {
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        if (!normalized.isEmpty()) {
            tags.add(normalized);
        }
    }

    private static String baseName(String fileName) {
        if (fileName == null) {
            return null;
        }
        String name = fileName.substring(fileName.lastIndexOf('/') + 1);
        if (name.endsWith(PathGuard.MARKDOWN_SUFFIX)) {
            name = name.substring(0, name.length() - PathGuard.MARKDOWN_SUFFIX.length());
        }
        return name;
    }

    private static final class Replacement {
        private final Pattern pattern;
        private final String replacement;

        private Replacement(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }
    }
}
