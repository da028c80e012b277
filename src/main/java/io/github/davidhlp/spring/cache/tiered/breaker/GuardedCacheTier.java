package io.github.davidhlp.spring.cache.tiered.breaker;

import io.github.davidhlp.spring.cache.tiered.tier.CacheTier;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;
import io.github.davidhlp.spring.cache.tiered.tier.DurableCacheStore;
import io.github.davidhlp.spring.cache.tiered.tier.TierEntry;
import io.github.resilience4j.timelimiter.TimeLimiter;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 熔断 + 超时保护的缓存层包装
 *
 * <p>熔断器打开时直接抛出 {@link CircuitBreakerOpenException}，不发起任何 I/O。
 * 超时与连接错误一样计入熔断失败。未命中（返回 null）算作成功调用。
 */
@Slf4j
public class GuardedCacheTier implements DurableCacheStore {

    private final CacheTier delegate;
    private final TierCircuitBreaker circuitBreaker;
    private final TierCallExecutor callExecutor;
    private final TimeLimiter timeLimiter;

    /**
     * @param circuitBreaker 可为 null，表示只做超时保护
     */
    public GuardedCacheTier(
            CacheTier delegate, TierCircuitBreaker circuitBreaker, TierCallExecutor callExecutor, Duration timeout) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.callExecutor = callExecutor;
        this.timeLimiter = TierCallExecutor.timeLimiter(delegate.name(), timeout);
    }

    public TierCircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public TierEntry get(String key) {
        return call("get", () -> delegate.get(key));
    }

    @Override
    public void set(TierEntry entry, Duration ttl) {
        call("set", () -> {
            delegate.set(entry, ttl);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        call("delete", () -> {
            delegate.delete(key);
            return null;
        });
    }

    @Override
    public Map<String, TierEntry> mget(List<String> keys) {
        return call("mget", () -> delegate.mget(keys));
    }

    @Override
    public void mset(Collection<TierEntry> entries, Duration ttl) {
        call("mset", () -> {
            delegate.mset(entries, ttl);
            return null;
        });
    }

    @Override
    public Set<String> deleteByTags(Collection<String> tags) {
        return call("deleteByTags", () -> delegate.deleteByTags(tags));
    }

    @Override
    public Set<String> deleteByPattern(String glob) {
        return call("deleteByPattern", () -> delegate.deleteByPattern(glob));
    }

    @Override
    public void ping() {
        call("ping", () -> {
            delegate.ping();
            return null;
        });
    }

    @Override
    public List<TierEntry> findWarmCandidates(Collection<String> tags, int limit, Instant now) {
        if (!(delegate instanceof DurableCacheStore durableStore)) {
            throw new CacheTierException(delegate.name(), "Tier '" + delegate.name() + "' does not support warming");
        }
        return call("findWarmCandidates", () -> durableStore.findWarmCandidates(tags, limit, now));
    }

    private <T> T call(String operation, Callable<T> call) {
        if (circuitBreaker != null && !circuitBreaker.tryAcquirePermission()) {
            throw new CircuitBreakerOpenException(delegate.name(), circuitBreaker.getNextTrialAt());
        }

        long start = System.nanoTime();
        try {
            T result = callExecutor.execute(delegate.name(), operation, call, timeLimiter);
            if (circuitBreaker != null) {
                circuitBreaker.onSuccess(System.nanoTime() - start);
            }
            return result;
        } catch (CacheTierException e) {
            if (circuitBreaker != null) {
                circuitBreaker.onFailure(System.nanoTime() - start, e);
            }
            log.debug("Tier call failed: tier={}, operation={}, error={}", delegate.name(), operation, e.getMessage());
            throw e;
        }
    }
}
