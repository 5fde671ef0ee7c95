package org.docstore.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 日志工具类
 * 业务日志与性能日志分别写入独立的 logger，由 logback-spring.xml 路由。
 */
public class LogUtils {

    // 业务日志记录器
    private static final Logger BUSINESS_LOGGER = LoggerFactory.getLogger("org.docstore.business");

    // 性能日志记录器
    private static final Logger PERFORMANCE_LOGGER = LoggerFactory.getLogger("org.docstore.performance");

    // MDC键名常量
    public static final String USER_ID = "userId";
    public static final String REQUEST_ID = "requestId";
    public static final String VAULT_ID = "vaultId";
    public static final String OPERATION = "operation";

    /**
     * 记录业务日志
     */
    public static void logBusiness(String operation, String userId, String message, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            MDC.put(USER_ID, userId);
            BUSINESS_LOGGER.info("[{}] [用户:{}] {}", operation, userId, formatMessage(message, args));
        } finally {
            MDC.remove(OPERATION);
            MDC.remove(USER_ID);
        }
    }

    /**
     * 记录业务错误日志
     */
    public static void logBusinessError(String operation, String userId, String message, Throwable throwable, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            MDC.put(USER_ID, userId);
            BUSINESS_LOGGER.error("[{}] [用户:{}] {}", operation, userId, formatMessage(message, args), throwable);
        } finally {
            MDC.remove(OPERATION);
            MDC.remove(USER_ID);
        }
    }

    /**
     * 记录性能日志
     */
    public static void logPerformance(String operation, long duration, String details) {
        try {
            MDC.put(OPERATION, operation);
            PERFORMANCE_LOGGER.info("[性能] [{}] 耗时:{}ms {}", operation, duration, details);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录用户操作日志
     */
    public static void logUserOperation(String userId, String operation, String resource, String result) {
        try {
            MDC.put(USER_ID, userId);
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.info("[用户操作] [用户:{}] [操作:{}] [资源:{}] [结果:{}]", userId, operation, resource, result);
        } finally {
            MDC.remove(OPERATION);
            MDC.remove(USER_ID);
        }
    }

    /**
     * 记录文档变更日志
     */
    public static void logDocumentChange(String vaultId, String operation, String path, String contentHash, String source) {
        try {
            MDC.put(VAULT_ID, vaultId);
            MDC.put(OPERATION, "DOC_" + operation);
            BUSINESS_LOGGER.info("[文档变更] [知识库:{}] [操作:{}] [路径:{}] [哈希:{}] [来源:{}]",
                    vaultId, operation, path, contentHash, source);
        } finally {
            MDC.remove(VAULT_ID);
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录系统启动日志
     */
    public static void logSystemStart(String component, String status, String details) {
        BUSINESS_LOGGER.info("[系统启动] [组件:{}] [状态:{}] {}", component, status, details);
    }

    /**
     * 记录系统错误日志
     */
    public static void logSystemError(String component, String error, Throwable throwable) {
        BUSINESS_LOGGER.error("[系统错误] [组件:{}] [错误:{}]", component, error, throwable);
    }

    /**
     * 设置请求上下文
     */
    public static void setRequestContext(String requestId, String userId) {
        MDC.put(REQUEST_ID, requestId);
        if (userId != null) {
            MDC.put(USER_ID, userId);
        }
    }

    /**
     * 清除请求上下文
     */
    public static void clearRequestContext() {
        MDC.clear();
    }

    private static String formatMessage(String message, Object... args) {
        if (args == null || args.length == 0) {
            return message;
        }
        try {
            return String.format(message, args);
        } catch (Exception e) {
            return message + " [格式化参数失败: " + e.getMessage() + "]";
        }
    }

    /**
     * 性能监控装饰器
     */
    public static class PerformanceMonitor {
        private final String operation;
        private final long startTime;

        public PerformanceMonitor(String operation) {
            this.operation = operation;
            this.startTime = System.currentTimeMillis();
        }

        public void end() {
            end("");
        }

        public void end(String details) {
            logPerformance(operation, System.currentTimeMillis() - startTime, details);
        }
    }

    public static PerformanceMonitor startPerformanceMonitor(String operation) {
        return new PerformanceMonitor(operation);
    }
}
