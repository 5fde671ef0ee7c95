package org.docstore.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 数据目录监听线程
 * 递归注册数据根目录下所有非隐藏目录，新建目录时补注册并把其中已有的文件作为变更上报。
 * 事件只负责上报，过滤、防抖和处理都在 Listener 一侧完成。
 */
public class VaultWatcher extends Thread implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(VaultWatcher.class);

    /**
     * 监听事件回调，在监听线程上调用，实现方不应阻塞
     */
    public interface Listener {
        void onFileChanged(Path file);

        void onFileDeleted(Path file);

        // 事件丢失，需要全量对账
        void onOverflow();
    }

    private final Path root;
    private final Listener listener;
    private final WatchService watchService;
    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public VaultWatcher(Path root, Listener listener) throws IOException {
        super("docstore-watcher");
        setDaemon(true);
        this.root = root;
        this.listener = listener;
        this.watchService = FileSystems.getDefault().newWatchService();
        registerAll(root);
    }

    @Override
    public void run() {
        logger.info("开始监听数据目录: {}, 已注册目录 {} 个", root, watchKeys.size());
        while (!closed && !isInterrupted()) {
            WatchKey key;
            try {
                key = watchService.poll(1000, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
            if (key == null) {
                continue;
            }

            Path dir = watchKeys.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    dispatch(dir, event);
                }
            }
            if (!key.reset()) {
                // 目录已被删除
                watchKeys.remove(key);
            }
        }
        logger.info("数据目录监听已停止: {}", root);
    }

    private void dispatch(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        try {
            if (kind == StandardWatchEventKinds.OVERFLOW) {
                logger.warn("监听事件溢出，触发全量对账: {}", dir);
                listener.onOverflow();
                return;
            }
            Path changed = dir.resolve((Path) event.context());
            if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
                listener.onFileDeleted(changed);
            } else if (Files.isDirectory(changed)) {
                if (kind == StandardWatchEventKinds.ENTRY_CREATE && !isHidden(changed)) {
                    registerAll(changed);
                    reportExistingFiles(changed);
                }
            } else {
                listener.onFileChanged(changed);
            }
        } catch (IOException e) {
            logger.error("处理监听事件失败: dir={}, kind={}", dir, kind.name(), e);
        } catch (RuntimeException e) {
            // 单个事件失败不影响监听线程
            logger.error("监听回调异常: dir={}, kind={}", dir, kind.name(), e);
        }
    }

    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(start) && isHidden(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_DELETE,
                        StandardWatchEventKinds.ENTRY_MODIFY);
                watchKeys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    // 目录在注册之前可能已经写入了文件（例如整个目录被复制进来）
    private void reportExistingFiles(Path dir) throws IOException {
        Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                return !d.equals(dir) && isHidden(d) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                listener.onFileChanged(file);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    int registeredDirectories() {
        return watchKeys.size();
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    @Override
    public void close() throws IOException {
        closed = true;
        interrupt();
        watchService.close();
    }
}
