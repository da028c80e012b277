package io.github.davidhlp.spring.cache.tiered.stats;

public enum HealthStatus {
    HEALTHY,
    /** 一级缓存可用但远程层不可用 */
    DEGRADED,
    UNHEALTHY
}
