package io.github.davidhlp.spring.cache.tiered.stats;

/**
 * 操作耗时指标
 *
 * @param averageGetTime get 平均耗时（毫秒）
 * @param averageSetTime set 平均耗时（毫秒）
 * @param totalOperations 所有公开操作的调用次数
 */
public record PerformanceMetrics(double averageGetTime, double averageSetTime, long totalOperations) {}
