package io.github.davidhlp.spring.cache.tiered.breaker;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/** 熔断器状态 */
public enum CircuitBreakerState {
    /** 正常放行 */
    CLOSED,
    /** 短路所有调用，直到冷却结束 */
    OPEN,
    /** 冷却结束，仅放行一次试探调用 */
    HALF_OPEN;

    static CircuitBreakerState of(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return OPEN;
            case HALF_OPEN:
                return HALF_OPEN;
            default:
                return CLOSED;
        }
    }
}
