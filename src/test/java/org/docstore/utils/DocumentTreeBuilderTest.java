package org.docstore.utils;

import org.docstore.DTO.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTreeBuilderTest {

    @Test
    void buildsNestedTreeFromFlatPaths() {
        List<TreeNode> tree = DocumentTreeBuilder.build(List.of("notes/x.md", "notes/y.md", "z.md"));

        assertEquals(2, tree.size());
        TreeNode notes = tree.get(0);
        assertEquals("notes", notes.getName());
        assertEquals("notes", notes.getPath());
        assertEquals("directory", notes.getType());
        assertEquals(2, notes.getChildren().size());
        assertEquals("notes/x.md", notes.getChildren().get(0).getPath());
        assertEquals("y.md", notes.getChildren().get(1).getName());
        assertEquals("file", notes.getChildren().get(1).getType());
        assertNull(notes.getChildren().get(0).getChildren());

        TreeNode z = tree.get(1);
        assertEquals("z.md", z.getName());
        assertEquals("file", z.getType());
        assertNull(z.getChildren());
    }

    @Test
    void sharesDirectoryNodesAcrossDepths() {
        List<TreeNode> tree = DocumentTreeBuilder.build(List.of("a/b/c.md", "a/d.md", "a/b/e.md"));

        assertEquals(1, tree.size());
        TreeNode a = tree.get(0);
        assertEquals(2, a.getChildren().size());
        TreeNode b = a.getChildren().get(0);
        assertTrue(b.isDirectory());
        assertEquals("a/b", b.getPath());
        assertEquals(2, b.getChildren().size());
        assertEquals("a/b/c.md", b.getChildren().get(0).getPath());
        assertEquals("a/b/e.md", b.getChildren().get(1).getPath());
        assertEquals("a/d.md", a.getChildren().get(1).getPath());
    }

    @Test
    void emptyInputGivesEmptyTree() {
        assertTrue(DocumentTreeBuilder.build(List.of()).isEmpty());
    }
}
