package org.docstore.service;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.docstore.DTO.FileEntry;
import org.docstore.DTO.PathType;
import org.docstore.config.DocStoreProperties;
import org.docstore.exception.ConflictException;
import org.docstore.exception.NotFoundException;
import org.docstore.exception.ValidationException;
import org.docstore.utils.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * 知识库文件存储服务
 * 负责磁盘上的所有读写：原子写入（临时文件 + rename）、删除后清理空目录、移动、复制和目录遍历。
 * 所有相对路径都先经过 {@link PathGuard} 校验。
 */
@Service
public class FileStorageService {

    private static final Logger logger = LoggerFactory.getLogger(FileStorageService.class);

    static final String TEMP_PREFIX = ".tmp-";

    private final Path dataRoot;
    private final SecureRandom random = new SecureRandom();

    public FileStorageService(DocStoreProperties properties) {
        this.dataRoot = Paths.get(properties.getDataDir()).toAbsolutePath().normalize();
    }

    public Path getDataRoot() {
        return dataRoot;
    }

    /**
     * 知识库目录：dataRoot/userId/slug
     */
    public Path vaultPath(UUID userId, String slug) {
        return dataRoot.resolve(userId.toString()).resolve(slug).normalize();
    }

    public Path ensureVaultDir(UUID userId, String slug) throws IOException {
        return Files.createDirectories(vaultPath(userId, slug));
    }

    // 目录不存在时直接返回
    public void deleteVaultDir(UUID userId, String slug) throws IOException {
        Path vaultDir = vaultPath(userId, slug);
        if (Files.exists(vaultDir, LinkOption.NOFOLLOW_LINKS)) {
            deleteRecursively(vaultDir);
            logger.info("已删除知识库目录: {}", vaultDir);
        }
    }

    /**
     * 原子写入：先写同目录下的临时文件，再 rename 覆盖目标文件。
     * 读者只会看到旧内容或新内容，不会看到写了一半的文件。
     */
    public void write(Path root, String relativePath, String content) throws IOException {
        Path target = PathGuard.resolveFile(root, relativePath);
        Path parent = target.getParent();
        Files.createDirectories(parent);

        Path temp = parent.resolve(TEMP_PREFIX + randomHex());
        try {
            Files.write(temp, content.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    public String read(Path root, String relativePath) throws IOException {
        Path file = PathGuard.resolveFile(root, relativePath);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("File not found: " + relativePath, e);
        }
    }

    /**
     * 删除文件，并向上清理变空的父目录（不会删除知识库根目录）
     */
    public void delete(Path root, String relativePath) throws IOException {
        Path file = PathGuard.resolveFile(root, relativePath);
        try {
            Files.delete(file);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("File not found: " + relativePath, e);
        }
        removeEmptyParents(root, file.getParent());
    }

    public void deleteDirectory(Path root, String relativeDir) throws IOException {
        Path dir = PathGuard.resolveDir(root, relativeDir);
        if (PathGuard.isRoot(relativeDir)) {
            throw new ValidationException("Cannot delete the vault root");
        }
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            throw new NotFoundException("Directory not found: " + relativeDir);
        }
        deleteRecursively(dir);
        removeEmptyParents(root, dir.getParent());
    }

    public void createDirectory(Path root, String relativeDir) throws IOException {
        if (PathGuard.isRoot(relativeDir)) {
            throw new ValidationException("Path cannot be empty");
        }
        Path dir = PathGuard.resolveDir(root, relativeDir);
        if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            throw new ConflictException("A file already exists at: " + relativeDir);
        }
        Files.createDirectories(dir);
    }

    /**
     * 移动文件或目录
     *
     * @return 源路径的类型（FILE 或 DIRECTORY）
     */
    public PathType move(Path root, String source, String destination, boolean overwrite) throws IOException {
        Endpoints endpoints = prepareTransfer(root, source, destination, overwrite);
        Files.createDirectories(endpoints.target.getParent());
        Files.move(endpoints.source, endpoints.target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        removeEmptyParents(root, endpoints.source.getParent());
        return endpoints.type;
    }

    /**
     * 复制文件或目录；符号链接按链接本身复制，不会跟随
     *
     * @return 源路径的类型（FILE 或 DIRECTORY）
     */
    public PathType copy(Path root, String source, String destination, boolean overwrite) throws IOException {
        Endpoints endpoints = prepareTransfer(root, source, destination, overwrite);
        Files.createDirectories(endpoints.target.getParent());
        if (endpoints.type == PathType.FILE) {
            Files.copy(endpoints.source, endpoints.target,
                    StandardCopyOption.REPLACE_EXISTING, LinkOption.NOFOLLOW_LINKS);
            return PathType.FILE;
        }
        try (Stream<Path> paths = Files.walk(endpoints.source)) {
            for (Path p : (Iterable<Path>) paths::iterator) {
                Path dest = endpoints.target.resolve(endpoints.source.relativize(p).toString());
                if (Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)) {
                    Files.createDirectories(dest);
                } else {
                    Files.copy(p, dest, StandardCopyOption.REPLACE_EXISTING, LinkOption.NOFOLLOW_LINKS);
                }
            }
        }
        return PathType.DIRECTORY;
    }

    /**
     * 遍历目录下所有文件和子目录（跳过以 . 开头的名称），结果按路径排序。
     * 起始目录不存在时返回空列表。
     */
    public List<FileEntry> list(Path root, String relativeDir) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        Path start = PathGuard.resolveDir(root, relativeDir);
        List<FileEntry> entries = new ArrayList<>();
        if (!Files.isDirectory(start, LinkOption.NOFOLLOW_LINKS)) {
            return entries;
        }

        Deque<Path> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path child : stream) {
                    String name = child.getFileName().toString();
                    if (name.startsWith(".")) {
                        continue;
                    }
                    BasicFileAttributes attrs;
                    try {
                        attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                    } catch (NoSuchFileException e) {
                        // 遍历过程中被删除
                        continue;
                    }
                    String relative = toRelative(base, child);
                    if (attrs.isDirectory()) {
                        pending.push(child);
                        entries.add(new FileEntry(name, relative, true, 0L, attrs.lastModifiedTime().toInstant()));
                    } else {
                        entries.add(new FileEntry(name, relative, false, attrs.size(), attrs.lastModifiedTime().toInstant()));
                    }
                }
            }
        }
        entries.sort(Comparator.comparing(FileEntry::getPath));
        return entries;
    }

    // 知识库内全部 Markdown 文件的相对路径
    public List<String> listMarkdownFiles(Path root) throws IOException {
        List<String> files = new ArrayList<>();
        for (FileEntry entry : list(root, "")) {
            if (!entry.isDirectory() && entry.getName().endsWith(PathGuard.MARKDOWN_SUFFIX)) {
                files.add(entry.getPath());
            }
        }
        return files;
    }

    /**
     * 判断路径类型；任何 I/O 问题都按不存在处理，不抛异常
     */
    public PathType pathExists(Path root, String relativePath) {
        Path target = PathGuard.resolveDir(root, relativePath);
        try {
            BasicFileAttributes attrs = Files.readAttributes(target, BasicFileAttributes.class);
            return attrs.isDirectory() ? PathType.DIRECTORY : PathType.FILE;
        } catch (IOException e) {
            return PathType.ABSENT;
        }
    }

    public String hash(String content) {
        return DigestUtils.sha256Hex(content.getBytes(StandardCharsets.UTF_8));
    }

    public long sizeOf(String content) {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    private Endpoints prepareTransfer(Path root, String source, String destination, boolean overwrite) throws IOException {
        if (PathGuard.isRoot(source) || PathGuard.isRoot(destination)) {
            throw new ValidationException("Path cannot be empty");
        }
        Path sourcePath = PathGuard.resolveDir(root, source);
        Path targetPath = PathGuard.resolveDir(root, destination);

        PathType type = pathExists(root, source);
        if (type == PathType.ABSENT) {
            throw new NotFoundException("Source not found: " + source);
        }
        if (type == PathType.FILE) {
            PathGuard.validateFilePath(destination);
        } else if (targetPath.startsWith(sourcePath)) {
            throw new ValidationException("Cannot move or copy a directory into itself");
        }
        if (sourcePath.equals(targetPath)) {
            throw new ValidationException("Source and destination are the same");
        }
        if (Files.exists(targetPath, LinkOption.NOFOLLOW_LINKS)) {
            if (!overwrite) {
                throw new ConflictException("Destination already exists: " + destination);
            }
            if (Files.isDirectory(targetPath, LinkOption.NOFOLLOW_LINKS)) {
                deleteRecursively(targetPath);
            }
        }
        return new Endpoints(sourcePath, targetPath, type);
    }

    private void removeEmptyParents(Path root, Path dir) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        Path current = dir;
        while (current != null && current.startsWith(base) && !current.equals(base)) {
            if (!Files.isDirectory(current, LinkOption.NOFOLLOW_LINKS)) {
                current = current.getParent();
                continue;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                if (stream.iterator().hasNext()) {
                    return;
                }
            }
            Files.delete(current);
            logger.debug("已清理空目录: {}", current);
            current = current.getParent();
        }
    }

    private void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> ordered = new ArrayList<>();
            paths.forEach(ordered::add);
            // 先删子项
            ordered.sort(Comparator.reverseOrder());
            for (Path p : ordered) {
                Files.deleteIfExists(p);
            }
        }
    }

    private String randomHex() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }

    private static String toRelative(Path base, Path child) {
        return base.relativize(child).toString().replace('\\', '/');
    }

    private static final class Endpoints {
        private final Path source;
        private final Path target;
        private final PathType type;

        private Endpoints(Path source, Path target, PathType type) {
            this.source = source;
            this.target = target;
            this.type = type;
        }
    }
}
