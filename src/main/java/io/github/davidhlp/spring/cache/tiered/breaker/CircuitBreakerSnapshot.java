package io.github.davidhlp.spring.cache.tiered.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * 熔断器只读快照
 *
 * @param nextTrialAt 仅在 OPEN 状态下有意义
 */
public record CircuitBreakerSnapshot(
        String name,
        CircuitBreakerState state,
        int consecutiveFailures,
        Instant lastFailureAt,
        Instant nextTrialAt,
        Duration currentCooldown,
        long totalFailures,
        long shortCircuitedCalls) {}
