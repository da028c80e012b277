package io.github.davidhlp.spring.cache.tiered.support;

import io.github.davidhlp.spring.cache.tiered.breaker.CircuitBreakerOpenException;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * 缓存异常处理工具类
 * 提供统一的异常处理和日志记录
 *
 * <p>熔断短路只记 DEBUG，缓存层故障记 WARN，其他异常记 ERROR。
 */
@Slf4j
public final class CacheExceptionHandler {

    private CacheExceptionHandler() {
        // 工具类不允许实例化
    }

    /**
     * 安全执行操作，发生异常时记录日志并返回默认值
     *
     * @param operation     要执行的操作
     * @param defaultValue  默认值
     * @param operationName 操作名称（用于日志）
     * @param context       上下文信息（用于日志）
     * @return 操作结果或默认值
     */
    public static <T> T safeExecute(Supplier<T> operation, T defaultValue, String operationName, Object... context) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            logException(operationName, e, context);
            return defaultValue;
        }
    }

    /**
     * 安全执行操作，发生异常时记录日志（无返回值）
     *
     * @return 是否执行成功
     */
    public static boolean safeExecute(Runnable operation, String operationName, Object... context) {
        try {
            operation.run();
            return true;
        } catch (RuntimeException e) {
            logException(operationName, e, context);
            return false;
        }
    }

    /**
     * 记录异常日志
     */
    public static void logException(String operationName, Exception e, Object... context) {
        if (e instanceof CircuitBreakerOpenException) {
            log.debug("Operation '{}' short-circuited with context {}: {}",
                    operationName, formatContext(context), e.getMessage());
        } else if (e instanceof CacheTierException) {
            log.warn("Operation '{}' failed with context {}: {}",
                    operationName, formatContext(context), e.getMessage());
        } else {
            log.error("Operation '{}' failed with context {}: {}",
                    operationName, formatContext(context), e.getMessage(), e);
        }
    }

    /**
     * 格式化错误描述，形如 {@code <tier>: <message>}
     */
    public static String describe(String tierName, Exception e) {
        return tierName + ": " + e.getMessage();
    }

    /**
     * 格式化上下文信息
     */
    private static String formatContext(Object... context) {
        if (context.length == 0) {
            return "[]";
        }

        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < context.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(context[i]);
        }
        sb.append("]");
        return sb.toString();
    }
}
