package io.github.davidhlp.spring.cache.tiered.stats;

/**
 * 健康检查结果
 *
 * @param latencyMillis 整个检查的耗时
 */
public record CacheHealth(
        HealthStatus status, boolean local, boolean remote, boolean durable, long latencyMillis) {}
