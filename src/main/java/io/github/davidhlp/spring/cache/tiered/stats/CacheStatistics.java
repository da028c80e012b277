package io.github.davidhlp.spring.cache.tiered.stats;

import io.github.davidhlp.spring.cache.tiered.breaker.CircuitBreakerSnapshot;

/**
 * 整体统计快照
 *
 * @param durableBreaker 持久层未启用熔断时为 null
 */
public record CacheStatistics(
        LocalTierStats l1,
        TierStats l2,
        TierStats l3,
        CircuitBreakerSnapshot remoteBreaker,
        CircuitBreakerSnapshot durableBreaker) {}
