package org.docstore.sync;

/**
 * 单个路径的同步状态：IDLE -> DEBOUNCING -> PROCESSING -> IDLE
 */
public enum SyncState {
    IDLE,
    DEBOUNCING,
    PROCESSING
}
