package org.docstore.sync;

import org.docstore.config.DocStoreProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 自身写入登记表
 * DocumentService 在写盘前登记绝对路径，SyncService 在入队前查询；
 * 有效期内的监听事件视为本进程写入的回声，直接丢弃。
 * 条目只按时间过期，查询不会消费条目。
 */
@Component
public class RecentWriteRegistry {

    private final Duration ttl;
    private final int capacity;
    private final Clock clock;

    // 按登记顺序排列，容量超限时淘汰最早的条目
    private final LinkedHashMap<Path, Instant> entries = new LinkedHashMap<>();

    @Autowired
    public RecentWriteRegistry(DocStoreProperties properties, Clock clock) {
        this(properties.getSync().getRecentWriteTtl(), properties.getSync().getRecentWriteCapacity(), clock);
    }

    public RecentWriteRegistry(Duration ttl, int capacity, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("recent write ttl must be positive");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("recent write capacity must be at least 1");
        }
        this.ttl = ttl;
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized void register(Path absolutePath) {
        Path key = absolutePath.toAbsolutePath().normalize();
        purgeExpired();
        entries.remove(key);
        entries.put(key, clock.instant().plus(ttl));
        while (entries.size() > capacity) {
            Iterator<Map.Entry<Path, Instant>> it = entries.entrySet().iterator();
            it.next();
            it.remove();
        }
    }

    public synchronized boolean isRecent(Path absolutePath) {
        purgeExpired();
        return entries.containsKey(absolutePath.toAbsolutePath().normalize());
    }

    public synchronized int size() {
        purgeExpired();
        return entries.size();
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        entries.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
    }
}
