package io.github.davidhlp.spring.cache.tiered.breaker;

import io.github.davidhlp.spring.cache.tiered.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/** 熔断器状态机测试 */
class TierCircuitBreakerTest {

    private static final RuntimeException FAILURE = new RuntimeException("boom");
    private static final Duration PAST_COOLDOWN = Duration.ofSeconds(30).plusMillis(1);

    private MutableClock clock;
    private TierCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new TierCircuitBreaker("remote", 3, Duration.ofSeconds(30), clock);
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThat(breaker.tryAcquirePermission()).isTrue();
            breaker.onFailure(1_000L, FAILURE);
        }
    }

    @Nested
    class Closed {

        @Test
        void testOpensAfterThreshold() {
            failTimes(2);
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);

            failTimes(1);

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
            assertThat(breaker.getNextTrialAt()).isEqualTo(clock.instant().plus(Duration.ofSeconds(30)));
            assertThat(breaker.snapshot().lastFailureAt()).isEqualTo(clock.instant());
        }

        @Test
        void testSuccessResetsConsecutiveFailures() {
            failTimes(2);
            breaker.tryAcquirePermission();
            breaker.onSuccess(1_000L);
            failTimes(2);

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(2);
            assertThat(breaker.snapshot().totalFailures()).isEqualTo(4);
            assertThat(breaker.getNextTrialAt()).isNull();
        }
    }

    @Nested
    class Open {

        @BeforeEach
        void open() {
            failTimes(3);
        }

        @Test
        void testShortCircuitsUntilCooldownPasses() {
            clock.advance(Duration.ofSeconds(29));

            assertThat(breaker.tryAcquirePermission()).isFalse();
            assertThat(breaker.tryAcquirePermission()).isFalse();
            assertThat(breaker.snapshot().shortCircuitedCalls()).isEqualTo(2);
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        }

        @Test
        void testAdmitsSingleTrialAfterCooldown() {
            clock.advance(PAST_COOLDOWN);

            assertThat(breaker.tryAcquirePermission()).isTrue();
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
            assertThat(breaker.tryAcquirePermission()).isFalse();
            assertThat(breaker.snapshot().nextTrialAt()).isNull();
        }

        @Test
        void testConcurrentCallersGetOneTrial() throws Exception {
            clock.advance(PAST_COOLDOWN);
            int threads = 32;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    results.add(executor.submit(() -> {
                        start.await();
                        return breaker.tryAcquirePermission();
                    }));
                }
                start.countDown();

                int admitted = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(5, TimeUnit.SECONDS)) {
                        admitted++;
                    }
                }
                assertThat(admitted).isEqualTo(1);
                assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
                assertThat(breaker.snapshot().shortCircuitedCalls()).isEqualTo(threads - 1);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        void testTrialSuccessCloses() {
            clock.advance(PAST_COOLDOWN);
            breaker.tryAcquirePermission();

            breaker.onSuccess(1_000L);

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(breaker.snapshot().consecutiveFailures()).isZero();
            assertThat(breaker.snapshot().nextTrialAt()).isNull();
            assertThat(breaker.tryAcquirePermission()).isTrue();
        }

        @Test
        void testTrialFailureReopensWithFreshCooldown() {
            clock.advance(PAST_COOLDOWN);
            breaker.tryAcquirePermission();

            breaker.onFailure(1_000L, FAILURE);

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
            assertThat(breaker.getNextTrialAt()).isEqualTo(clock.instant().plus(Duration.ofSeconds(30)));
            assertThat(breaker.tryAcquirePermission()).isFalse();
        }

        @Test
        void testResetForcesClosed() {
            breaker.reset();

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(breaker.tryAcquirePermission()).isTrue();
        }
    }

    @Nested
    class Backoff {

        @Test
        void testCooldownGrowsAndIsCapped() {
            TierCircuitBreaker backoff = new TierCircuitBreaker(
                    "durable", 1, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(25), clock);
            backoff.tryAcquirePermission();
            backoff.onFailure(1_000L, FAILURE);
            assertThat(backoff.snapshot().currentCooldown()).isEqualTo(Duration.ofSeconds(10));

            clock.advance(Duration.ofSeconds(10).plusMillis(1));
            assertThat(backoff.tryAcquirePermission()).isTrue();
            backoff.onFailure(1_000L, FAILURE);
            assertThat(backoff.snapshot().currentCooldown()).isEqualTo(Duration.ofSeconds(20));

            clock.advance(Duration.ofSeconds(20).plusMillis(1));
            assertThat(backoff.tryAcquirePermission()).isTrue();
            backoff.onFailure(1_000L, FAILURE);
            assertThat(backoff.snapshot().currentCooldown()).isEqualTo(Duration.ofSeconds(25));
            assertThat(backoff.getNextTrialAt()).isEqualTo(clock.instant().plus(Duration.ofSeconds(25)));

            clock.advance(Duration.ofSeconds(25).plusMillis(1));
            assertThat(backoff.tryAcquirePermission()).isTrue();
            backoff.onSuccess(1_000L);
            assertThat(backoff.getState()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(backoff.snapshot().currentCooldown()).isEqualTo(Duration.ofSeconds(10));
        }

        @Test
        void testRejectsInvalidArguments() {
            assertThatThrownBy(() -> new TierCircuitBreaker("x", 0, Duration.ofSeconds(1), clock))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new TierCircuitBreaker(
                    "x", 1, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(2), clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
