package org.docstore.service;

import org.docstore.DTO.ExtractedContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownExtractorTest {

    private final MarkdownExtractor extractor = new MarkdownExtractor();

    @Test
    void readsFrontmatterTitleAndTags() {
        String content = "---\n" +
                "title: Weekly Review\n" +
                "tags: [Work, ideas]\n" +
                "---\n" +
                "# Ignored heading\n" +
                "Plan the #Project launch.\n";

        ExtractedContent result = extractor.extract(content, "reviews/week-1.md");

        assertEquals("Weekly Review", result.getTitle());
        assertEquals(List.of("ideas", "project", "work"), result.getTags());
        assertEquals("Weekly Review", result.getFrontmatter().get("title"));
        assertTrue(result.getBody().startsWith("# Ignored heading"));
        assertFalse(result.getStrippedContent().contains("---"));
    }

    @Test
    void acceptsCommaSeparatedTagString() {
        ExtractedContent result = extractor.extract("---\ntags: alpha, Beta ,alpha\n---\nbody", "a.md");
        assertEquals(List.of("alpha", "beta"), result.getTags());
    }

    @Test
    void titleFallsBackToHeadingThenFileName() {
        assertEquals("Shopping", extractor.extract("intro\n# Shopping\n## Sub", "x.md").getTitle());
        assertEquals("todo", extractor.extract("- [ ] buy milk\n", "notes/todo.md").getTitle());
    }

    @Test
    void ignoresBlankFrontmatterTitle() {
        ExtractedContent result = extractor.extract("---\ntitle: \"  \"\n---\n# Real\n", "a.md");
        assertEquals("Real", result.getTitle());
    }

    @Test
    void tagsInsideCodeAreIgnored() {
        String content = "Use `#inline` here\n" +
                "```\n#fenced\n```\n" +
                "but #real-tag counts, a#b does not, #1digit neither";
        assertEquals(List.of("real-tag"), extractor.extract(content, "a.md").getTags());
    }

    @Test
    void headingsAreNotTags() {
        assertTrue(extractor.extract("# Title\n## Second\n", "a.md").getTags().isEmpty());
    }

    @Test
    void malformedFrontmatterKeepsWholeContentAsBody() {
        String content = "---\ntitle: [unclosed\n---\nBody text";
        ExtractedContent result = extractor.extract(content, "broken.md");
        assertTrue(result.getFrontmatter().isEmpty());
        assertEquals(content, result.getBody());
        assertEquals("broken", result.getTitle());
    }

    @Test
    void nonMappingFrontmatterIsIgnored() {
        String content = "---\n- just\n- a list\n---\ntext";
        ExtractedContent result = extractor.extract(content, "list.md");
        assertTrue(result.getFrontmatter().isEmpty());
        assertEquals(content, result.getBody());
    }

    @Test
    void emptyFrontmatterBlock() {
        ExtractedContent result = extractor.extract("---\n---\nhello", "a.md");
        assertTrue(result.getFrontmatter().isEmpty());
        assertEquals("hello", result.getBody());
    }

    @Test
    void stripsMarkdownSyntax() {
        String content = "# Heading\n\n" +
                "Some **bold**, *italic* and ~~gone~~ text with a [link](https://example.com) " +
                "and ![alt text](img.png).\n\n" +
                "> quoted line\n" +
                "- item one\n" +
                "1. first\n" +
                "---\n" +
                "<b>html</b> and `code`\n\n\n\n" +
                "```java\nint x = 1;\n```\n" +
                "end";

        String stripped = extractor.extract(content, "a.md").getStrippedContent();

        assertTrue(stripped.startsWith("Heading\n\nSome bold, italic and gone text with a link and alt text."));
        assertTrue(stripped.contains("quoted line"));
        assertTrue(stripped.contains("item one"));
        assertTrue(stripped.contains("first"));
        assertTrue(stripped.contains("html and code"));
        assertFalse(stripped.contains("int x"));
        assertFalse(stripped.contains("\n\n\n"));
        assertTrue(stripped.endsWith("end"));
    }

    @Test
    void plainChecklistHasNoTags() {
        ExtractedContent result = extractor.extract("- [ ] buy milk\n", "notes/todo.md");
        assertTrue(result.getTags().isEmpty());
        assertTrue(result.getFrontmatter().isEmpty());
        assertEquals("[ ] buy milk", result.getStrippedContent());
    }
}
