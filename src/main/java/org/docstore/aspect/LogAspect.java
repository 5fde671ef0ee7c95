package org.docstore.aspect;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.docstore.annotation.LogAction;
import org.docstore.controller.UserHeader;
import org.docstore.utils.LogUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.UUID;

@Aspect
@Component
@Slf4j
public class LogAspect {

    // 请求/响应对象不参与参数日志
    private static final Class<?>[] IGNORED_CLASSES = {
            ServletRequest.class, ServletResponse.class
    };

    // 文档正文可能很大，参数日志只保留前面一段
    private static final int MAX_ARG_LENGTH = 200;

    @Around("@annotation(logAction)")
    public Object doAround(ProceedingJoinPoint joinPoint, LogAction logAction) throws Throwable {
        String module = logAction.value();
        String action = logAction.action();

        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attributes != null ? attributes.getRequest() : null;

        String userId = "UNKNOWN";
        String clientIp = "0.0.0.0";
        if (request != null) {
            String header = request.getHeader(UserHeader.NAME);
            if (header != null && !header.isBlank()) {
                userId = header;
            }
            clientIp = request.getRemoteAddr();
        }

        LogUtils.setRequestContext(UUID.randomUUID().toString(), userId);
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor(module + "-" + action);

        if (logAction.logArgs()) {
            LogUtils.logBusiness(module, userId, "[%s] 请求开始, IP: %s, 参数: %s", action, clientIp, describeArgs(joinPoint));
        }

        try {
            Object result = joinPoint.proceed();
            LogUtils.logUserOperation(userId, module, action, "SUCCESS");
            monitor.end("执行成功");
            return result;
        } catch (Throwable e) {
            // 异常交给 GlobalExceptionHandler 处理
            LogUtils.logBusinessError(module, userId, action + " 执行异常: " + e.getMessage(), e);
            monitor.end("执行失败: " + e.getMessage());
            throw e;
        } finally {
            LogUtils.clearRequestContext();
        }
    }

    private String describeArgs(ProceedingJoinPoint joinPoint) {
        StringBuilder sb = new StringBuilder();
        for (Object arg : joinPoint.getArgs()) {
            if (arg != null && !isIgnored(arg)) {
                String text = arg.toString();
                if (text.length() > MAX_ARG_LENGTH) {
                    text = text.substring(0, MAX_ARG_LENGTH) + "...(" + text.length() + " chars)";
                }
                sb.append(text).append(' ');
            }
        }
        return sb.toString().trim();
    }

    private boolean isIgnored(Object arg) {
        for (Class<?> clazz : IGNORED_CLASSES) {
            if (clazz.isInstance(arg)) return true;
        }
        return false;
    }
}
