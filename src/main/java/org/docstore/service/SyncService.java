package org.docstore.service;

import jakarta.annotation.PreDestroy;
import org.docstore.config.DocStoreProperties;
import org.docstore.entity.Document;
import org.docstore.entity.Vault;
import org.docstore.exception.ValidationException;
import org.docstore.repository.DocumentRepository;
import org.docstore.sync.ReconcileReport;
import org.docstore.sync.RecentWriteRegistry;
import org.docstore.sync.SyncState;
import org.docstore.sync.VaultFileRef;
import org.docstore.sync.VaultWatcher;
import org.docstore.utils.LogUtils;
import org.docstore.utils.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 文件系统同步服务
 * 外部工具（WebDAV 客户端、编辑器）直接改动数据目录时，通过监听事件和定时对账把变化同步到文档目录。
 * 事件处理与对账都在单线程调度器上串行执行。
 */
@Service
public class SyncService implements VaultWatcher.Listener {

    private static final Logger logger = LoggerFactory.getLogger(SyncService.class);

    private enum EventKind {CHANGE, DELETE, DIRECTORY_DELETE}

    private static final class PendingEvent {
        private final EventKind kind;
        private final ScheduledFuture<?> future;

        private PendingEvent(EventKind kind, ScheduledFuture<?> future) {
            this.kind = kind;
            this.future = future;
        }
    }

    private final DocStoreProperties properties;
    private final FileStorageService fileStorageService;
    private final DocumentService documentService;
    private final VaultService vaultService;
    private final DocumentRepository documentRepository;
    private final RecentWriteRegistry recentWrites;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Map<Path, PendingEvent> pending = new ConcurrentHashMap<>();
    private final Set<Path> processing = ConcurrentHashMap.newKeySet();
    // vaultId:path -> 连续缺失的对账轮数
    private final Map<String, Integer> missingPasses = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile VaultWatcher watcher;
    private volatile boolean stopping;

    public SyncService(DocStoreProperties properties,
                       FileStorageService fileStorageService,
                       DocumentService documentService,
                       VaultService vaultService,
                       DocumentRepository documentRepository,
                       RecentWriteRegistry recentWrites,
                       TaskScheduler taskScheduler,
                       Clock clock) {
        this.properties = properties;
        this.fileStorageService = fileStorageService;
        this.documentService = documentService;
        this.vaultService = vaultService;
        this.documentRepository = documentRepository;
        this.recentWrites = recentWrites;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.getSync().isEnabled()) {
            LogUtils.logSystemStart("SyncService", "DISABLED", "docstore.sync.enabled=false");
            return;
        }
        Path dataRoot = fileStorageService.getDataRoot();
        try {
            Files.createDirectories(dataRoot);
            VaultWatcher started = new VaultWatcher(dataRoot, this);
            started.start();
            watcher = started;
            LogUtils.logSystemStart("SyncService", "STARTED", "dataRoot=" + dataRoot);
        } catch (IOException e) {
            // 监听不可用时仍然依靠定时对账
            LogUtils.logSystemError("SyncService", "无法启动目录监听: " + dataRoot, e);
        }
        if (properties.getSync().isReconcileOnStartup()) {
            taskScheduler.schedule(this::scheduledReconcile, clock.instant());
        }
    }

    /**
     * 定时全量对账，间隔见 docstore.sync.reconcile-interval
     */
    @Scheduled(fixedDelayString = "${docstore.sync.reconcile-interval:PT6H}",
            initialDelayString = "${docstore.sync.reconcile-interval:PT6H}")
    public void scheduledReconcile() {
        if (!properties.getSync().isEnabled() || stopping) {
            return;
        }
        try {
            reconcile();
        } catch (Exception e) {
            LogUtils.logSystemError("SyncService", "对账失败", e);
        }
    }

    @Override
    public void onFileChanged(Path file) {
        enqueue(file, EventKind.CHANGE);
    }

    /**
     * 删除事件只带路径：不是 .md 的路径按目录处理（目录被删除或被外部重命名时，子文件不会单独上报）
     */
    @Override
    public void onFileDeleted(Path file) {
        if (file.toString().endsWith(PathGuard.MARKDOWN_SUFFIX)) {
            enqueue(file, EventKind.DELETE);
        } else {
            enqueue(file, EventKind.DIRECTORY_DELETE);
        }
    }

    @Override
    public void onOverflow() {
        if (!stopping) {
            taskScheduler.schedule(this::scheduledReconcile, clock.instant());
        }
    }

    /**
     * 过滤后按路径防抖：防抖窗口内的新事件会重置计时
     */
    private void enqueue(Path file, EventKind kind) {
        if (stopping) {
            return;
        }
        Path path = file.toAbsolutePath().normalize();
        boolean ignored = kind == EventKind.DIRECTORY_DELETE
                ? parseDirectoryPath(path).isEmpty()
                : shouldIgnore(path);
        if (ignored) {
            return;
        }
        if (recentWrites.isRecent(path)) {
            logger.debug("忽略自身写入产生的事件: {}", path);
            return;
        }
        synchronized (pending) {
            PendingEvent previous = pending.get(path);
            if (previous != null) {
                previous.future.cancel(false);
            }
            ScheduledFuture<?> future = taskScheduler.schedule(() -> process(path),
                    clock.instant().plus(properties.getSync().getDebounce()));
            pending.put(path, new PendingEvent(kind, future));
        }
    }

    public SyncState stateOf(Path file) {
        Path path = file.toAbsolutePath().normalize();
        if (processing.contains(path)) {
            return SyncState.PROCESSING;
        }
        return pending.containsKey(path) ? SyncState.DEBOUNCING : SyncState.IDLE;
    }

    void process(Path path) {
        PendingEvent event;
        synchronized (pending) {
            event = pending.remove(path);
            if (event == null || stopping) {
                return;
            }
            processing.add(path);
        }
        inFlight.incrementAndGet();
        try {
            handle(path, event.kind);
        } catch (Exception e) {
            logger.error("同步文件失败: {} ({})", path, event.kind, e);
        } finally {
            processing.remove(path);
            inFlight.decrementAndGet();
        }
    }

    private void handle(Path path, EventKind kind) throws IOException {
        if (kind == EventKind.DIRECTORY_DELETE) {
            handleDirectoryDelete(path);
            return;
        }
        Optional<VaultFileRef> ref = parseFilePath(path);
        if (ref.isEmpty()) {
            return;
        }
        Optional<Vault> vault = vaultService.findBySlug(ref.get().getUserId(), ref.get().getVaultSlug());
        if (vault.isEmpty()) {
            logger.debug("知识库不存在，忽略事件: {}", path);
            return;
        }
        String docPath = ref.get().getDocPath();
        // 以处理时的磁盘状态为准：删除后又重建的文件按变更处理
        if (Files.isRegularFile(path)) {
            String content = fileStorageService.read(
                    fileStorageService.vaultPath(vault.get().getUserId(), vault.get().getSlug()), docPath);
            documentService.syncFromDisk(vault.get(), docPath, content);
            logger.info("已同步外部变更: vault={}, path={}", vault.get().getSlug(), docPath);
        } else if (documentService.removeMissing(vault.get().getId(), docPath)) {
            logger.info("已同步外部删除: vault={}, path={}", vault.get().getSlug(), docPath);
        } else if (kind == EventKind.CHANGE) {
            logger.debug("文件已不存在: {}", path);
        }
    }

    // 目录下仍在目录记录中、但磁盘上已不存在的文档逐个删除
    private void handleDirectoryDelete(Path path) {
        Optional<VaultFileRef> ref = parseDirectoryPath(path);
        if (ref.isEmpty() || Files.isDirectory(path)) {
            return;
        }
        Optional<Vault> vault = vaultService.findBySlug(ref.get().getUserId(), ref.get().getVaultSlug());
        if (vault.isEmpty()) {
            return;
        }
        Path root = fileStorageService.vaultPath(vault.get().getUserId(), vault.get().getSlug());
        String pattern = DocumentService.escapeLike(ref.get().getDocPath()) + "/%";
        int removed = 0;
        for (Document document : documentRepository.findUnderPrefix(vault.get().getId(), pattern)) {
            if (Files.isRegularFile(PathGuard.resolveFile(root, document.getPath()))) {
                continue;
            }
            if (documentService.removeMissing(vault.get().getId(), document.getPath())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("已同步外部目录删除: vault={}, dir={}, 文档 {} 个", vault.get().getSlug(), ref.get().getDocPath(), removed);
        }
    }

    /**
     * 数据目录下的绝对路径 -> (userId, vaultSlug, docPath)；至少需要三段
     */
    public Optional<VaultFileRef> parseFilePath(Path file) {
        Path root = fileStorageService.getDataRoot();
        Path path = file.toAbsolutePath().normalize();
        if (!path.startsWith(root) || path.getNameCount() - root.getNameCount() < 3) {
            return Optional.empty();
        }
        Path relative = root.relativize(path);
        UUID userId;
        try {
            userId = UUID.fromString(relative.getName(0).toString());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        String slug = relative.getName(1).toString();
        String docPath = relative.subpath(2, relative.getNameCount()).toString().replace('\\', '/');
        try {
            PathGuard.validateFilePath(docPath);
        } catch (ValidationException e) {
            return Optional.empty();
        }
        return Optional.of(new VaultFileRef(userId, slug, docPath));
    }

    /**
     * 同 parseFilePath，但 docPath 是知识库内的目录（不能是知识库根目录，不能含隐藏段）
     */
    Optional<VaultFileRef> parseDirectoryPath(Path dir) {
        Path root = fileStorageService.getDataRoot();
        Path path = dir.toAbsolutePath().normalize();
        if (!path.startsWith(root) || path.getNameCount() - root.getNameCount() < 3) {
            return Optional.empty();
        }
        Path relative = root.relativize(path);
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return Optional.empty();
            }
        }
        UUID userId;
        try {
            userId = UUID.fromString(relative.getName(0).toString());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        String docPath = relative.subpath(2, relative.getNameCount()).toString().replace('\\', '/');
        try {
            PathGuard.validateDirPath(docPath);
        } catch (ValidationException e) {
            return Optional.empty();
        }
        return Optional.of(new VaultFileRef(userId, relative.getName(1).toString(), docPath));
    }

    /**
     * 忽略隐藏文件、隐藏目录（.obsidian、.tmp-* 等）下的路径和非 Markdown 文件
     */
    public boolean shouldIgnore(Path file) {
        Path root = fileStorageService.getDataRoot();
        Path path = file.toAbsolutePath().normalize();
        if (!path.startsWith(root)) {
            return true;
        }
        for (Path segment : root.relativize(path)) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        if (!path.toString().endsWith(PathGuard.MARKDOWN_SUFFIX)) {
            return true;
        }
        return parseFilePath(path).isEmpty();
    }

    /**
     * 全量对账：逐个知识库比较磁盘上的 .md 文件与目录记录
     */
    public synchronized ReconcileReport reconcile() throws IOException {
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("RECONCILE");
        ReconcileReport total = new ReconcileReport();
        Set<UUID> visited = new HashSet<>();
        inFlight.incrementAndGet();
        try {
            Path dataRoot = fileStorageService.getDataRoot();
            if (!Files.isDirectory(dataRoot)) {
                return total;
            }
            try (DirectoryStream<Path> users = Files.newDirectoryStream(dataRoot, Files::isDirectory)) {
                for (Path userDir : users) {
                    if (stopping) {
                        break;
                    }
                    UUID userId = parseUserId(userDir);
                    if (userId == null) {
                        continue;
                    }
                    try (DirectoryStream<Path> vaults = Files.newDirectoryStream(userDir, Files::isDirectory)) {
                        for (Path vaultDir : vaults) {
                            String slug = vaultDir.getFileName().toString();
                            if (slug.startsWith(".") || stopping) {
                                continue;
                            }
                            Optional<Vault> vault = vaultService.findBySlug(userId, slug);
                            if (vault.isEmpty()) {
                                logger.debug("目录没有对应的知识库记录，跳过: {}", vaultDir);
                                continue;
                            }
                            visited.add(vault.get().getId());
                            total.merge(reconcileVault(vault.get(), vaultDir));
                        }
                    }
                }
            }
            if (!stopping) {
                // 知识库已删除或目录已不存在时，其计数不会再被访问
                missingPasses.keySet().removeIf(key -> !visited.contains(UUID.fromString(vaultIdOf(key))));
            }
        } finally {
            inFlight.decrementAndGet();
            monitor.end(String.format("知识库:%d 新增:%d 更新:%d 未变:%d 删除:%d 待确认:%d 失败:%d",
                    total.getVaults(), total.getAdded(), total.getUpdated(), total.getUnchanged(),
                    total.getRemoved(), total.getFlagged(), total.getFailed()));
        }
        return total;
    }

    ReconcileReport reconcileVault(Vault vault, Path root) throws IOException {
        ReconcileReport report = new ReconcileReport();
        report.setVaults(1);

        Map<String, Document> catalog = new LinkedHashMap<>();
        for (Document document : documentRepository.findByVaultIdOrderByPathAsc(vault.getId())) {
            catalog.put(document.getPath(), document);
        }
        List<String> onDisk = fileStorageService.listMarkdownFiles(root);
        Set<String> diskPaths = new HashSet<>(onDisk);

        for (String path : onDisk) {
            if (stopping) {
                return report;
            }
            missingPasses.remove(missingKey(vault, path));
            if (recentWrites.isRecent(PathGuard.resolveFile(root, path))) {
                report.setSkipped(report.getSkipped() + 1);
                continue;
            }
            try {
                String content = fileStorageService.read(root, path);
                Document existing = catalog.get(path);
                if (existing != null && fileStorageService.hash(content).equals(existing.getContentHash())) {
                    report.setUnchanged(report.getUnchanged() + 1);
                    continue;
                }
                documentService.syncFromDisk(vault, path, content);
                if (existing == null) {
                    report.setAdded(report.getAdded() + 1);
                } else {
                    report.setUpdated(report.getUpdated() + 1);
                }
            } catch (Exception e) {
                report.setFailed(report.getFailed() + 1);
                logger.error("对账同步文件失败: vault={}, path={}", vault.getSlug(), path, e);
            }
        }

        int required = Math.max(1, properties.getSync().getOrphanConfirmPasses());
        for (String path : catalog.keySet()) {
            if (diskPaths.contains(path)) {
                continue;
            }
            if (recentWrites.isRecent(PathGuard.resolveFile(root, path))) {
                report.setSkipped(report.getSkipped() + 1);
                continue;
            }
            String key = missingKey(vault, path);
            int passes = missingPasses.merge(key, 1, Integer::sum);
            if (passes < required) {
                report.setFlagged(report.getFlagged() + 1);
                logger.warn("文档在磁盘上缺失（第 {}/{} 轮），暂不删除: vault={}, path={}",
                        passes, required, vault.getSlug(), path);
                continue;
            }
            try {
                documentService.removeMissing(vault.getId(), path);
                missingPasses.remove(key);
                report.setRemoved(report.getRemoved() + 1);
            } catch (Exception e) {
                report.setFailed(report.getFailed() + 1);
                logger.error("对账删除记录失败: vault={}, path={}", vault.getSlug(), path, e);
            }
        }

        // 期间经 API 删除的文档不会再出现在目录记录中
        String prefix = vault.getId() + ":";
        missingPasses.keySet().removeIf(key -> key.startsWith(prefix)
                && !catalog.containsKey(key.substring(prefix.length())));
        return report;
    }

    /**
     * 停机顺序：停止对账与监听 -> 取消防抖中的事件 -> 等待处理中的任务结束
     */
    @PreDestroy
    public void stop() {
        stopping = true;
        VaultWatcher current = watcher;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                logger.warn("关闭目录监听失败", e);
            }
        }
        synchronized (pending) {
            pending.values().forEach(event -> event.future.cancel(false));
            pending.clear();
        }

        long deadline = System.nanoTime() + properties.getSync().getShutdownTimeout().toNanos();
        while (inFlight.get() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (inFlight.get() > 0) {
            logger.warn("停机等待超时，仍有 {} 个同步任务未完成", inFlight.get());
        }
        logger.info("同步服务已停止");
    }

    private static UUID parseUserId(Path userDir) {
        try {
            return UUID.fromString(userDir.getFileName().toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String missingKey(Vault vault, String path) {
        return vault.getId() + ":" + path;
    }

    private static String vaultIdOf(String missingKey) {
        return missingKey.substring(0, missingKey.indexOf(':'));
    }

    int pendingOrphans() {
        return missingPasses.size();
    }
}
