package io.github.davidhlp.spring.cache.tiered.breaker;

import io.github.davidhlp.spring.cache.tiered.support.InMemoryCacheTier;
import io.github.davidhlp.spring.cache.tiered.support.MutableClock;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierTimeoutException;
import io.github.davidhlp.spring.cache.tiered.tier.TierEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/** 熔断与超时保护测试 */
class GuardedCacheTierTest {

    private MutableClock clock;
    private InMemoryCacheTier delegate;
    private TierCircuitBreaker breaker;
    private TierCallExecutor callExecutor;
    private GuardedCacheTier guarded;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        delegate = InMemoryCacheTier.remote(clock);
        breaker = new TierCircuitBreaker("remote", 3, Duration.ofSeconds(30), clock);
        callExecutor = new TierCallExecutor();
        guarded = new GuardedCacheTier(delegate, breaker, callExecutor, Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        callExecutor.close();
    }

    private static TierEntry entry(String key, String value) {
        return TierEntry.builder().key(key).value(value.getBytes(StandardCharsets.UTF_8)).build();
    }

    @Test
    void testDelegatesWhenClosed() {
        guarded.set(entry("a", "1"), Duration.ofMinutes(1));

        assertThat(guarded.get("a")).isNotNull();
        assertThat(guarded.get("missing")).isNull();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void testOpenBreakerMakesNoCalls() {
        delegate.failAll(true);
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> guarded.get("a")).isInstanceOf(CacheTierException.class);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        delegate.resetCalls();

        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> guarded.get("a")).isInstanceOf(CircuitBreakerOpenException.class);
        }

        assertThat(delegate.totalCalls()).isZero();
    }

    @Test
    void testTrialAfterCooldownReachesDelegateOnce() {
        delegate.failAll(true);
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> guarded.delete("a")).isInstanceOf(CacheTierException.class);
        }
        delegate.resetCalls();
        delegate.failAll(false);
        clock.advance(Duration.ofSeconds(31));

        guarded.delete("a");

        assertThat(delegate.calls("delete")).isEqualTo(1);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void testConcurrentCallersDuringTrialReachDelegateOnce() throws Exception {
        delegate.failAll(true);
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> guarded.get("a")).isInstanceOf(CacheTierException.class);
        }
        delegate.resetCalls();
        delegate.failAll(false);
        delegate.delay(Duration.ofMillis(300));
        clock.advance(Duration.ofSeconds(31));

        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                outcomes.add(executor.submit(() -> {
                    start.await();
                    try {
                        guarded.get("a");
                        return true;
                    } catch (CircuitBreakerOpenException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int reached = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(5, TimeUnit.SECONDS)) {
                    reached++;
                }
            }
            assertThat(reached).isEqualTo(1);
            assertThat(delegate.calls("get")).isEqualTo(1);
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testTimeoutCountsAsFailure() {
        delegate.delay(Duration.ofSeconds(2));

        assertThatThrownBy(() -> guarded.get("a"))
                .isInstanceOf(CacheTierTimeoutException.class)
                .hasMessageContaining("timed out");

        assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void testWithoutBreakerOnlyTimesOut() {
        GuardedCacheTier unguarded = new GuardedCacheTier(delegate, null, callExecutor, Duration.ofMillis(500));
        delegate.failAll(true);

        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> unguarded.mget(List.of("a"))).isInstanceOf(CacheTierException.class);
        }

        assertThat(delegate.calls("mget")).isEqualTo(10);
        assertThat(unguarded.getCircuitBreaker()).isNull();
    }

    @Test
    void testWarmCandidatesRequireDurableDelegate() {
        assertThat(guarded.findWarmCandidates(List.of(), 10, clock.instant())).isEmpty();
        assertThat(guarded.name()).isEqualTo("remote");
    }
}
