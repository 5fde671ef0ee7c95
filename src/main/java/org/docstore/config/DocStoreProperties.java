package org.docstore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 文档库全局配置：数据目录、同步与搜索参数。
 */
@Component
@ConfigurationProperties(prefix = "docstore")
@Data
public class DocStoreProperties {

    /** 所有用户知识库的根目录，布局为 dataDir/userId/vaultSlug/... */
    private String dataDir = "./data/vaults";

    private Sync sync = new Sync();
    private Search search = new Search();

    @Data
    public static class Sync {
        /** 是否启动文件系统监听与定时对账 */
        private boolean enabled = true;
        /** 同一路径事件的防抖窗口 */
        private Duration debounce = Duration.ofMillis(500);
        /** 自身写入登记的有效期，窗口内的监听事件视为回声 */
        private Duration recentWriteTtl = Duration.ofSeconds(2);
        /** 登记表容量上限 */
        private int recentWriteCapacity = 10_000;
        /** 全量对账间隔 */
        private Duration reconcileInterval = Duration.ofHours(6);
        /** 启动后立即对账一次 */
        private boolean reconcileOnStartup = true;
        /** 目录中缺失的文档需连续缺失多少轮对账才从目录删除 */
        private int orphanConfirmPasses = 1;
        /** 停机时等待进行中事件处理的上限 */
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Search {
        /** 启动时为缺少全文索引向量的文档补算 */
        private boolean backfillOnStartup = false;
    }
}
