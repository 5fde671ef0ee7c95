package org.docstore.DTO;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 目录树节点，每次请求根据文档路径重新构建
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TreeNode {
    public static final String TYPE_FILE = "file";
    public static final String TYPE_DIRECTORY = "directory";

    private String name;
    private String path;
    private String type;
    private List<TreeNode> children; // 只有目录节点才有

    public static TreeNode file(String name, String path) {
        TreeNode node = new TreeNode();
        node.setName(name);
        node.setPath(path);
        node.setType(TYPE_FILE);
        return node;
    }

    public static TreeNode directory(String name, String path) {
        TreeNode node = new TreeNode();
        node.setName(name);
        node.setPath(path);
        node.setType(TYPE_DIRECTORY);
        node.setChildren(new ArrayList<>());
        return node;
    }

    public boolean isDirectory() {
        return TYPE_DIRECTORY.equals(type);
    }
}
