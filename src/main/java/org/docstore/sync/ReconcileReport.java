package org.docstore.sync;

import lombok.Data;

// 一轮对账的统计
@Data
public class ReconcileReport {
    private int vaults;
    private int added;
    private int updated;
    private int unchanged;
    private int removed;
    private int flagged;   // 本轮缺失但尚未达到确认轮数
    private int skipped;   // 正处于自身写入窗口内
    private int failed;

    public void merge(ReconcileReport other) {
        vaults += other.vaults;
        added += other.added;
        updated += other.updated;
        unchanged += other.unchanged;
        removed += other.removed;
        flagged += other.flagged;
        skipped += other.skipped;
        failed += other.failed;
    }
}
