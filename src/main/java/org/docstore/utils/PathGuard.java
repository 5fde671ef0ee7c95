package org.docstore.utils;

import org.docstore.exception.ValidationException;

import java.nio.file.Path;

/**
 * 路径安全校验工具类
 * 所有来自用户或监听事件的相对路径，在访问磁盘前都必须经过这里。
 * 语法校验之后还会做一次解析校验：解析结果必须落在知识库根目录之内。
 */
public final class PathGuard {

    public static final String MARKDOWN_SUFFIX = ".md";

    private PathGuard() {
    }

    /**
     * 校验文档路径（必须以 .md 结尾）
     */
    public static void validateFilePath(String relativePath) {
        if (relativePath == null || relativePath.trim().isEmpty()) {
            throw new ValidationException("Path cannot be empty");
        }
        checkSyntax(relativePath);
        if (!relativePath.endsWith(MARKDOWN_SUFFIX)) {
            throw new ValidationException("Path must end with .md");
        }
    }

    /**
     * 校验目录路径；空路径代表知识库根目录
     */
    public static void validateDirPath(String relativePath) {
        if (isRoot(relativePath)) {
            return;
        }
        checkSyntax(relativePath);
    }

    public static boolean isRoot(String relativePath) {
        return relativePath == null || relativePath.trim().isEmpty();
    }

    public static Path resolveFile(Path root, String relativePath) {
        validateFilePath(relativePath);
        return resolveInside(root, relativePath, false);
    }

    public static Path resolveDir(Path root, String relativePath) {
        validateDirPath(relativePath);
        if (isRoot(relativePath)) {
            return root.toAbsolutePath().normalize();
        }
        return resolveInside(root, relativePath, true);
    }

    private static void checkSyntax(String relativePath) {
        if (relativePath.indexOf('\0') >= 0) {
            throw new ValidationException("Path contains null bytes");
        }
        if (relativePath.indexOf('\\') >= 0) {
            throw new ValidationException("Path contains backslashes");
        }
        if (relativePath.startsWith("/")) {
            throw new ValidationException("Path must not start with /");
        }
        for (String segment : relativePath.split("/", -1)) {
            if ("..".equals(segment)) {
                throw new ValidationException("Path contains directory traversal");
            }
            if (segment.isEmpty()) {
                throw new ValidationException("Path contains empty segments");
            }
        }
    }

    private static Path resolveInside(Path root, String relativePath, boolean allowRoot) {
        Path base = root.toAbsolutePath().normalize();
        Path resolved = base.resolve(relativePath).normalize();
        boolean inside = resolved.startsWith(base) && !resolved.equals(base);
        if (!inside && !(allowRoot && resolved.equals(base))) {
            throw new ValidationException("Path escapes vault directory");
        }
        return resolved;
    }
}
