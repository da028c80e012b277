package io.github.davidhlp.spring.cache.tiered.breaker;

import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;

import java.time.Instant;

/** 熔断器处于打开状态，调用被短路 */
public class CircuitBreakerOpenException extends CacheTierException {

    private final Instant nextTrialAt;

    public CircuitBreakerOpenException(String tierName, Instant nextTrialAt) {
        super(tierName, "Circuit breaker for tier '" + tierName + "' is open, next trial at " + nextTrialAt);
        this.nextTrialAt = nextTrialAt;
    }

    public Instant getNextTrialAt() {
        return nextTrialAt;
    }
}
