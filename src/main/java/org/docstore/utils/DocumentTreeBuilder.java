package org.docstore.utils;

import org.docstore.DTO.TreeNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 根据文档路径集合构建目录树
 * 目录节点只有在其下（递归）至少存在一个文档时才会出现。
 */
public final class DocumentTreeBuilder {

    private DocumentTreeBuilder() {
    }

    public static List<TreeNode> build(Collection<String> paths) {
        List<TreeNode> roots = new ArrayList<>();
        // 目录路径 -> 节点
        Map<String, TreeNode> directories = new HashMap<>();

        for (String path : new TreeSet<>(paths)) {
            String[] parts = path.split("/");
            List<TreeNode> level = roots;
            StringBuilder current = new StringBuilder();

            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    current.append('/');
                }
                current.append(parts[i]);
                String currentPath = current.toString();

                if (i == parts.length - 1) {
                    level.add(TreeNode.file(parts[i], currentPath));
                } else {
                    TreeNode dir = directories.get(currentPath);
                    if (dir == null) {
                        dir = TreeNode.directory(parts[i], currentPath);
                        directories.put(currentPath, dir);
                        level.add(dir);
                    }
                    level = dir.getChildren();
                }
            }
        }
        return roots;
    }
}
