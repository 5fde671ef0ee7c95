package org.docstore.service;

import org.docstore.DTO.DocumentContent;
import org.docstore.DTO.DocumentDTO;
import org.docstore.DTO.DocumentListItem;
import org.docstore.DTO.DocumentVersionDTO;
import org.docstore.DTO.ExtractedContent;
import org.docstore.DTO.FileOperationResult;
import org.docstore.DTO.PathType;
import org.docstore.DTO.TreeNode;
import org.docstore.entity.ChangeSource;
import org.docstore.entity.Document;
import org.docstore.entity.DocumentVersion;
import org.docstore.entity.Vault;
import org.docstore.exception.ConflictException;
import org.docstore.exception.NotFoundException;
import org.docstore.exception.ValidationException;
import org.docstore.repository.DocumentRepository;
import org.docstore.repository.DocumentVersionRepository;
import org.docstore.sync.RecentWriteRegistry;
import org.docstore.utils.BaseDirPaths;
import org.docstore.utils.DocumentTreeBuilder;
import org.docstore.utils.LogUtils;
import org.docstore.utils.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 文档目录服务
 * 磁盘保存内容，数据库保存元数据与版本历史。所有写入都遵循同一套流程：
 * 计算内容哈希 -> 与目录中的哈希比较 -> 相同则直接返回，不同则先写盘再更新目录并追加版本。
 */
@Service
public class DocumentService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentRepository documentRepository;
    private final DocumentVersionRepository versionRepository;
    private final VaultService vaultService;
    private final FileStorageService fileStorageService;
    private final MarkdownExtractor markdownExtractor;
    private final RecentWriteRegistry recentWrites;
    private final Clock clock;

    public DocumentService(DocumentRepository documentRepository,
                           DocumentVersionRepository versionRepository,
                           VaultService vaultService,
                           FileStorageService fileStorageService,
                           MarkdownExtractor markdownExtractor,
                           RecentWriteRegistry recentWrites,
                           Clock clock) {
        this.documentRepository = documentRepository;
        this.versionRepository = versionRepository;
        this.vaultService = vaultService;
        this.fileStorageService = fileStorageService;
        this.markdownExtractor = markdownExtractor;
        this.recentWrites = recentWrites;
        this.clock = clock;
    }

    /**
     * 读取文档元数据和内容
     */
    @Transactional(readOnly = true, rollbackFor = Exception.class)
    public DocumentContent get(UUID userId, UUID vaultId, String path) throws IOException {
        Vault vault = vaultService.getRow(userId, vaultId);
        String internal = BaseDirPaths.toInternal(vault, path);
        PathGuard.validateFilePath(internal);

        Document document = documentRepository.findByVaultIdAndPath(vaultId, internal)
                .orElseThrow(() -> new NotFoundException("Document not found: " + path));
        String content = fileStorageService.read(rootOf(vault), internal);
        return new DocumentContent(DocumentDTO.from(document, path), content);
    }

    /**
     * 创建或更新文档（API / Web 写入）
     */
    @Transactional(rollbackFor = Exception.class)
    public DocumentDTO put(UUID userId, UUID vaultId, String path, String content, ChangeSource source) throws IOException {
        Vault vault = vaultService.getRow(userId, vaultId);
        String internal = BaseDirPaths.toInternal(vault, path);
        Document document = upsert(vault, internal, content, source, userId, true);
        return DocumentDTO.from(document, BaseDirPaths.toUser(vault, document.getPath()));
    }

    /**
     * 登记磁盘上已经存在的内容（文件监听与对账使用），不会再写盘
     */
    @Transactional(rollbackFor = Exception.class)
    public DocumentDTO syncFromDisk(Vault vault, String path, String content) throws IOException {
        Document document = upsert(vault, path, content, ChangeSource.WEBDAV, vault.getUserId(), false);
        return DocumentDTO.from(document, document.getPath());
    }

    /**
     * 删除文档；路径不是文档而是磁盘上的目录时，删除目录及其下所有文档
     */
    @Transactional(rollbackFor = Exception.class)
    public void remove(UUID userId, UUID vaultId, String path) throws IOException {
        if (PathGuard.isRoot(path)) {
            throw new ValidationException("Path cannot be empty");
        }
        Vault vault = vaultService.getRow(userId, vaultId);
        String internal = BaseDirPaths.toInternal(vault, path);
        PathGuard.validateDirPath(internal);
        Path root = rootOf(vault);

        Optional<Document> existing = documentRepository.findByVaultIdAndPath(vaultId, internal);
        if (existing.isPresent()) {
            recentWrites.register(PathGuard.resolveFile(root, internal));
            try {
                fileStorageService.delete(root, internal);
            } catch (NotFoundException e) {
                logger.warn("文档在磁盘上已不存在，仅删除目录记录: vault={}, path={}", vaultId, internal);
            }
            documentRepository.delete(existing.get());
            LogUtils.logDocumentChange(vaultId.toString(), "DELETE", internal, existing.get().getContentHash(), "api");
            return;
        }

        if (fileStorageService.pathExists(root, internal) == PathType.DIRECTORY) {
            String pattern = escapeLike(internal) + "/%";
            List<Document> children = documentRepository.findUnderPrefix(vaultId, pattern);
            recentWrites.register(PathGuard.resolveDir(root, internal));
            for (Document child : children) {
                recentWrites.register(PathGuard.resolveFile(root, child.getPath()));
            }
            int deleted = documentRepository.deleteUnderPrefix(vaultId, pattern);
            fileStorageService.deleteDirectory(root, internal);
            LogUtils.logBusiness("DELETE_DIRECTORY", userId.toString(), "删除目录 %s，包含文档 %d 个", internal, deleted);
            return;
        }

        throw new NotFoundException("Document or directory not found: " + path);
    }

    /**
     * 文件已从磁盘消失时，只删除目录记录（对账与监听使用）
     *
     * @return 是否删除了记录
     */
    @Transactional
    public boolean removeMissing(UUID vaultId, String path) {
        Optional<Document> existing = documentRepository.findByVaultIdAndPath(vaultId, path);
        if (existing.isEmpty()) {
            return false;
        }
        documentRepository.delete(existing.get());
        LogUtils.logDocumentChange(vaultId.toString(), "DELETE", path, existing.get().getContentHash(), "webdav");
        return true;
    }

    @Transactional(readOnly = true)
    public List<DocumentListItem> list(UUID userId, UUID vaultId, String dirPath) {
        Vault vault = vaultService.getRow(userId, vaultId);
        return visibleDocuments(vault, dirPath).stream()
                .map(doc -> new DocumentListItem(
                        BaseDirPaths.toUser(vault, doc.getPath()),
                        doc.getTitle(),
                        doc.getTags() == null ? new ArrayList<>() : new ArrayList<>(doc.getTags()),
                        doc.getSizeBytes(),
                        doc.getFileModifiedAt()))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<TreeNode> tree(UUID userId, UUID vaultId) {
        Vault vault = vaultService.getRow(userId, vaultId);
        List<String> paths = visibleDocuments(vault, null).stream()
                .map(doc -> BaseDirPaths.toUser(vault, doc.getPath()))
                .collect(Collectors.toList());
        return DocumentTreeBuilder.build(paths);
    }

    /**
     * 版本历史，最新的在前
     */
    @Transactional(readOnly = true)
    public List<DocumentVersionDTO> getVersions(UUID userId, UUID vaultId, String path) {
        Vault vault = vaultService.getRow(userId, vaultId);
        String internal = BaseDirPaths.toInternal(vault, path);
        Document document = documentRepository.findByVaultIdAndPath(vaultId, internal)
                .orElseThrow(() -> new NotFoundException("Document not found: " + path));
        return versionRepository.findByDocumentIdOrderByVersionNumDesc(document.getId()).stream()
                .map(DocumentVersionDTO::from)
                .collect(Collectors.toList());
    }

    public FileOperationResult createDirectory(UUID userId, UUID vaultId, String dirPath) throws IOException {
        if (PathGuard.isRoot(dirPath)) {
            throw new ValidationException("Path cannot be empty");
        }
        Vault vault = vaultService.getRow(userId, vaultId);
        String internal = BaseDirPaths.toInternal(vault, dirPath);
        fileStorageService.createDirectory(rootOf(vault), internal);
        return new FileOperationResult("Directory created successfully", null, dirPath);
    }

    /**
     * 移动/重命名文件或目录。文件移动只改一行的 path；目录移动用一条 UPDATE 改写前缀。
     */
    @Transactional(rollbackFor = Exception.class)
    public FileOperationResult move(UUID userId, UUID vaultId, String source, String destination, boolean overwrite)
            throws IOException {
        Vault vault = vaultService.getRow(userId, vaultId);
        Path root = rootOf(vault);
        String from = BaseDirPaths.toInternal(vault, source);
        String to = BaseDirPaths.toInternal(vault, destination);
        PathType type = sourceType(root, from, source);
        checkTransfer(type, source, destination, from, to);
        PathType destType = fileStorageService.pathExists(root, to);
        if (destType != PathType.ABSENT && !overwrite) {
            throw new ConflictException("Destination already exists: " + destination);
        }

        Document document = null;
        if (type == PathType.FILE) {
            document = documentRepository.findByVaultIdAndPath(vaultId, from)
                    .orElseThrow(() -> new NotFoundException("Document not found in database: " + source));
        }
        if (destType == PathType.DIRECTORY) {
            clearDestinationDirectory(root, vaultId, to);
        }

        if (type == PathType.FILE) {
            // 被覆盖的目标文档
            documentRepository.findByVaultIdAndPath(vaultId, to).ifPresent(replaced -> {
                documentRepository.delete(replaced);
                documentRepository.flush();
            });
            recentWrites.register(PathGuard.resolveFile(root, from));
            recentWrites.register(PathGuard.resolveFile(root, to));

            fileStorageService.move(root, from, to, overwrite);

            document.setPath(to);
            document.setUpdatedAt(now());
            documentRepository.save(document);
        } else {
            String fromPattern = escapeLike(from) + "/%";
            registerDirectoryMove(root, vaultId, from, to);

            fileStorageService.move(root, from, to, overwrite);

            String fromPrefix = from + "/";
            int moved = documentRepository.movePrefix(vaultId, fromPattern, to + "/",
                    fromPrefix.codePointCount(0, fromPrefix.length()) + 1);
            logger.info("目录移动完成: vault={}, {} -> {}, 文档 {} 个", vaultId, from, to, moved);
        }

        LogUtils.logDocumentChange(vaultId.toString(), "MOVE", from + " -> " + to, null, "api");
        return new FileOperationResult("Move operation completed successfully", source, destination);
    }

    /**
     * 复制文件或目录；新文档都按 api 来源创建版本 1
     */
    @Transactional(rollbackFor = Exception.class)
    public FileOperationResult copy(UUID userId, UUID vaultId, String source, String destination, boolean overwrite)
            throws IOException {
        Vault vault = vaultService.getRow(userId, vaultId);
        Path root = rootOf(vault);
        String from = BaseDirPaths.toInternal(vault, source);
        String to = BaseDirPaths.toInternal(vault, destination);
        PathType type = sourceType(root, from, source);
        checkTransfer(type, source, destination, from, to);
        PathType destType = fileStorageService.pathExists(root, to);
        if (destType != PathType.ABSENT && !overwrite) {
            throw new ConflictException("Destination already exists: " + destination);
        }
        if (type == PathType.FILE) {
            documentRepository.findByVaultIdAndPath(vaultId, from)
                    .orElseThrow(() -> new NotFoundException("Document not found: " + source));
        }
        if (destType == PathType.DIRECTORY) {
            clearDestinationDirectory(root, vaultId, to);
        }

        if (type == PathType.FILE) {
            String content = fileStorageService.read(root, from);
            upsert(vault, to, content, ChangeSource.API, userId, true);
        } else {
            List<String> sourceFiles = fileStorageService.listMarkdownFiles(PathGuard.resolveDir(root, from));
            for (String relative : sourceFiles) {
                recentWrites.register(PathGuard.resolveFile(root, to + "/" + relative));
            }

            fileStorageService.copy(root, from, to, overwrite);

            for (String relative : fileStorageService.listMarkdownFiles(PathGuard.resolveDir(root, to))) {
                String copied = to + "/" + relative;
                upsert(vault, copied, fileStorageService.read(root, copied), ChangeSource.API, userId, false);
            }
        }

        LogUtils.logDocumentChange(vaultId.toString(), "COPY", from + " -> " + to, null, "api");
        return new FileOperationResult("Copy operation completed successfully", source, destination);
    }

    /**
     * LIKE 模式转义：反斜杠、% 和 _
     */
    public static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /**
     * 哈希驱动的幂等更新：内容未变化时不写盘、不追加版本
     *
     * @param writeToDisk false 表示内容已经在磁盘上（来自监听或复制）
     */
    private Document upsert(Vault vault, String path, String content, ChangeSource source, UUID changedBy,
                            boolean writeToDisk) throws IOException {
        PathGuard.validateFilePath(path);
        if (content == null) {
            throw new ValidationException("Content is required");
        }
        Path root = rootOf(vault);
        String contentHash = fileStorageService.hash(content);
        long sizeBytes = fileStorageService.sizeOf(content);

        Optional<Document> existing = documentRepository.findByVaultIdAndPath(vault.getId(), path);
        if (existing.isPresent() && contentHash.equals(existing.get().getContentHash())) {
            return existing.get();
        }

        if (writeToDisk) {
            // 先登记再写盘，监听线程看到事件时一定能查到
            recentWrites.register(PathGuard.resolveFile(root, path));
            fileStorageService.write(root, path, content);
        }

        ExtractedContent extracted = markdownExtractor.extract(content, path);
        OffsetDateTime now = now();

        Document document = existing.orElseGet(Document::new);
        boolean created = existing.isEmpty();
        if (created) {
            document.setVaultId(vault.getId());
            document.setPath(path);
            document.setFileCreatedAt(now);
            document.setCreatedAt(now);
        }
        document.setTitle(extracted.getTitle());
        document.setContentHash(contentHash);
        document.setSizeBytes(sizeBytes);
        document.setFrontmatter(extracted.getFrontmatter().isEmpty() ? null : extracted.getFrontmatter());
        document.setTags(extracted.getTags());
        document.setStrippedContent(extracted.getStrippedContent());
        document.setFileModifiedAt(now);
        document.setUpdatedAt(now);
        Document saved = documentRepository.saveAndFlush(document);

        int versionNum = created ? 1 : versionRepository.findTopByDocumentIdOrderByVersionNumDesc(saved.getId())
                .map(latest -> latest.getVersionNum() + 1)
                .orElse(1);
        DocumentVersion version = new DocumentVersion();
        version.setDocumentId(saved.getId());
        version.setVersionNum(versionNum);
        version.setContentHash(contentHash);
        version.setSizeBytes(sizeBytes);
        version.setChangeSource(source);
        version.setChangedBy(changedBy);
        version.setCreatedAt(now);
        versionRepository.save(version);

        documentRepository.refreshSearchVector(saved.getId());

        LogUtils.logDocumentChange(vault.getId().toString(), created ? "CREATE" : "UPDATE", path, contentHash, source.value());
        logger.debug("文档已写入: vault={}, path={}, version={}", vault.getId(), path, versionNum);
        return saved;
    }

    private List<Document> visibleDocuments(Vault vault, String dirPath) {
        String internalDir = BaseDirPaths.toInternal(vault, dirPath);
        if (PathGuard.isRoot(internalDir)) {
            return documentRepository.findByVaultIdOrderByPathAsc(vault.getId());
        }
        PathGuard.validateDirPath(internalDir);
        return documentRepository.findUnderPrefix(vault.getId(), escapeLike(internalDir) + "/%");
    }

    private PathType sourceType(Path root, String internal, String userPath) {
        if (PathGuard.isRoot(internal)) {
            throw new ValidationException("Path cannot be empty");
        }
        PathType type = fileStorageService.pathExists(root, internal);
        if (type == PathType.ABSENT) {
            throw new NotFoundException("Source not found: " + userPath);
        }
        return type;
    }

    // 与 FileStorageService 的检查一致，需在改动目录记录之前完成
    private static void checkTransfer(PathType type, String source, String destination, String from, String to) {
        if (PathGuard.isRoot(source) || PathGuard.isRoot(destination) || PathGuard.isRoot(to)) {
            throw new ValidationException("Path cannot be empty");
        }
        if (type == PathType.FILE) {
            PathGuard.validateFilePath(to);
        } else {
            PathGuard.validateDirPath(to);
            if (to.startsWith(from + "/")) {
                throw new ValidationException("Cannot move or copy a directory into itself");
            }
        }
        if (from.equals(to)) {
            throw new ValidationException("Source and destination are the same");
        }
    }

    // 覆盖目标目录时磁盘上整棵目录会被删除，目录记录要先一起删掉
    private void clearDestinationDirectory(Path root, UUID vaultId, String to) {
        String pattern = escapeLike(to) + "/%";
        recentWrites.register(PathGuard.resolveDir(root, to));
        for (Document replaced : documentRepository.findUnderPrefix(vaultId, pattern)) {
            recentWrites.register(PathGuard.resolveFile(root, replaced.getPath()));
        }
        int deleted = documentRepository.deleteUnderPrefix(vaultId, pattern);
        documentRepository.flush();
        logger.info("覆盖目标目录，删除原有文档记录: vault={}, dir={}, 文档 {} 个", vaultId, to, deleted);
    }

    // 目录移动前登记新旧两侧的所有文档路径
    private void registerDirectoryMove(Path root, UUID vaultId, String from, String to) {
        recentWrites.register(PathGuard.resolveDir(root, from));
        recentWrites.register(PathGuard.resolveDir(root, to));
        for (Document child : documentRepository.findUnderPrefix(vaultId, escapeLike(from) + "/%")) {
            String rest = child.getPath().substring(from.length() + 1);
            recentWrites.register(PathGuard.resolveFile(root, child.getPath()));
            recentWrites.register(PathGuard.resolveFile(root, to + "/" + rest));
        }
    }

    private Path rootOf(Vault vault) {
        return fileStorageService.vaultPath(vault.getUserId(), vault.getSlug());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
