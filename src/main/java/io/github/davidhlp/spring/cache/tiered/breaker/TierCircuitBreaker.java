package io.github.davidhlp.spring.cache.tiered.breaker;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.core.IntervalFunction;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * 单个缓存层的熔断器，基于 Resilience4j {@link CircuitBreaker}
 *
 * <p>配置映射：
 * <ul>
 *   <li>COUNT_BASED 滑动窗口大小 = 最少调用数 = failureThreshold，失败率阈值 100%，即连续 N 次失败后打开
 *   <li>HALF_OPEN 只放行 1 次试探调用
 *   <li>冷却时间按 backoffMultiplier 指数增长，上限 maxCooldown；试探成功后恢复为初始值
 * </ul>
 *
 * <p>库的状态机不暴露连续失败数和下次试探时间，这里通过事件发布器同步维护。
 */
@Slf4j
public class TierCircuitBreaker {

    private final CircuitBreaker circuitBreaker;
    private final IntervalFunction cooldowns;
    private final Duration baseCooldown;
    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final LongAdder totalFailures = new LongAdder();
    private final LongAdder shortCircuitedCalls = new LongAdder();
    private final AtomicInteger openAttempts = new AtomicInteger();
    private volatile Instant lastFailureAt;
    private volatile Instant nextTrialAt;
    private volatile Duration currentCooldown;

    public TierCircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        this(name, failureThreshold, cooldown, 1.0d, cooldown, clock);
    }

    public TierCircuitBreaker(
            String name,
            int failureThreshold,
            Duration cooldown,
            double backoffMultiplier,
            Duration maxCooldown,
            Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive");
        }
        if (backoffMultiplier < 1.0d) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        Duration cap = maxCooldown == null || maxCooldown.compareTo(cooldown) < 0 ? cooldown : maxCooldown;
        this.cooldowns = backoffMultiplier > 1.0d
                ? IntervalFunction.ofExponentialBackoff(cooldown, backoffMultiplier, cap)
                : IntervalFunction.of(cooldown);
        this.baseCooldown = cooldown;
        this.currentCooldown = cooldown;
        this.clock = clock;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitIntervalFunctionInOpenState(cooldowns)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(Throwable.class)
                .writableStackTraceEnabled(false)
                .clock(clock)
                .build();
        this.circuitBreaker = CircuitBreaker.of(name, config);
        registerEventListeners();
    }

    private void registerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> onTransition(event.getStateTransition().getToState()))
                .onError(event -> {
                    consecutiveFailures.incrementAndGet();
                    totalFailures.increment();
                    lastFailureAt = clock.instant();
                })
                .onSuccess(event -> consecutiveFailures.set(0));
    }

    private void onTransition(CircuitBreaker.State to) {
        switch (to) {
            case OPEN:
            case FORCED_OPEN:
                Long cooldownMillis = cooldowns.apply(openAttempts.incrementAndGet());
                Duration next = cooldownMillis == null ? baseCooldown : Duration.ofMillis(cooldownMillis);
                currentCooldown = next;
                nextTrialAt = clock.instant().plus(next);
                log.warn("Circuit breaker '{}' opened after {} consecutive failures, cooldown {}ms",
                        getName(), consecutiveFailures.get(), next.toMillis());
                break;
            case HALF_OPEN:
                nextTrialAt = null;
                log.info("Circuit breaker '{}' transitioned OPEN -> HALF_OPEN, admitting trial call", getName());
                break;
            case CLOSED:
                openAttempts.set(0);
                consecutiveFailures.set(0);
                nextTrialAt = null;
                currentCooldown = baseCooldown;
                log.info("Circuit breaker '{}' transitioned to CLOSED", getName());
                break;
            default:
                break;
        }
    }

    public String getName() {
        return circuitBreaker.getName();
    }

    /**
     * 申请调用许可
     *
     * @return true 表示可以发起调用，结束后必须回报 {@link #onSuccess(long)} 或 {@link #onFailure(long, Throwable)}
     */
    public boolean tryAcquirePermission() {
        boolean permitted = circuitBreaker.tryAcquirePermission();
        if (!permitted) {
            shortCircuitedCalls.increment();
        }
        return permitted;
    }

    public void onSuccess(long elapsedNanos) {
        circuitBreaker.onSuccess(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void onFailure(long elapsedNanos, Throwable cause) {
        circuitBreaker.onError(elapsedNanos, TimeUnit.NANOSECONDS, cause);
    }

    /** 强制恢复为 CLOSED */
    public void reset() {
        circuitBreaker.reset();
        openAttempts.set(0);
        consecutiveFailures.set(0);
        nextTrialAt = null;
        currentCooldown = baseCooldown;
        log.info("Circuit breaker '{}' reset to CLOSED", getName());
    }

    public CircuitBreakerState getState() {
        return CircuitBreakerState.of(circuitBreaker.getState());
    }

    /** 仅在 OPEN 状态下非空 */
    public Instant getNextTrialAt() {
        return getState() == CircuitBreakerState.OPEN ? nextTrialAt : null;
    }

    public CircuitBreakerSnapshot snapshot() {
        CircuitBreakerState state = getState();
        return new CircuitBreakerSnapshot(
                getName(),
                state,
                consecutiveFailures.get(),
                lastFailureAt,
                state == CircuitBreakerState.OPEN ? nextTrialAt : null,
                currentCooldown,
                totalFailures.sum(),
                shortCircuitedCalls.sum());
    }
}
