package org.docstore.utils;

import org.docstore.entity.Vault;

/**
 * 知识库 baseDir 路径转换
 * 设置了 baseDir 的知识库只对外暴露该子目录：入参加前缀，出参去前缀。
 */
public final class BaseDirPaths {

    private BaseDirPaths() {
    }

    public static String toInternal(Vault vault, String userPath) {
        String baseDir = normalizedBaseDir(vault);
        if (baseDir == null) {
            return userPath;
        }
        if (PathGuard.isRoot(userPath)) {
            return baseDir;
        }
        return baseDir + "/" + userPath;
    }

    public static String toUser(Vault vault, String internalPath) {
        String baseDir = normalizedBaseDir(vault);
        if (baseDir == null || internalPath == null) {
            return internalPath;
        }
        if (internalPath.equals(baseDir)) {
            return "";
        }
        String prefix = baseDir + "/";
        return internalPath.startsWith(prefix) ? internalPath.substring(prefix.length()) : internalPath;
    }

    // 不在 baseDir 之下的文档对用户不可见
    public static boolean isVisible(Vault vault, String internalPath) {
        String baseDir = normalizedBaseDir(vault);
        return baseDir == null || internalPath.startsWith(baseDir + "/");
    }

    private static String normalizedBaseDir(Vault vault) {
        String baseDir = vault.getBaseDir();
        if (baseDir == null || baseDir.isBlank()) {
            return null;
        }
        String trimmed = baseDir.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? null : trimmed;
    }
}
