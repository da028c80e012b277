package io.github.davidhlp.spring.cache.tiered.core.version;

import io.github.davidhlp.spring.cache.tiered.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/** 键版本登记表测试 */
class KeyVersionRegistryTest {

    private MutableClock clock;
    private KeyVersionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new KeyVersionRegistry(clock, Duration.ofMinutes(1));
    }

    @Test
    void testPromotionAppliesWhenUnchanged() {
        long stamp = registry.readStamp();
        AtomicInteger applied = new AtomicInteger();

        assertThat(registry.applyIfUnchanged("a", stamp, applied::incrementAndGet)).isTrue();
        assertThat(applied.get()).isEqualTo(1);
    }

    @Test
    void testPromotionRejectedAfterMutation() {
        long stamp = registry.readStamp();
        registry.mutate("a", () -> {});
        AtomicInteger applied = new AtomicInteger();

        assertThat(registry.applyIfUnchanged("a", stamp, applied::incrementAndGet)).isFalse();
        assertThat(registry.isStale("a", stamp)).isTrue();
        assertThat(applied.get()).isZero();
    }

    @Test
    void testMutationOfOtherKeyDoesNotBlock() {
        long stamp = registry.readStamp();
        registry.mutate("b", () -> {});

        assertThat(registry.applyIfUnchanged("a", stamp, () -> {})).isTrue();
    }

    @Test
    void testNewStampAfterMutationApplies() {
        registry.mutate("a", () -> {});
        long stamp = registry.readStamp();

        assertThat(registry.applyIfUnchanged("a", stamp, () -> {})).isTrue();
    }

    @Test
    void testLaterMutationSupersedesEarlierVersion() {
        long first = registry.mutate("a", () -> {});
        long second = registry.mutate("a", () -> {});
        registry.mutate("b", () -> {});

        assertThat(second).isGreaterThan(first);
        assertThat(registry.isSuperseded("a", first)).isTrue();
        assertThat(registry.isSuperseded("a", second)).isFalse();
        assertThat(registry.isSuperseded("unknown", first)).isFalse();
    }

    @Test
    void testFlushRejectsEarlierStamps() {
        long before = registry.readStamp();
        AtomicInteger cleared = new AtomicInteger();

        registry.flush(cleared::incrementAndGet);

        assertThat(cleared.get()).isEqualTo(1);
        assertThat(registry.applyIfUnchanged("a", before, () -> {})).isFalse();
        assertThat(registry.applyIfUnchanged("a", registry.readStamp(), () -> {})).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    void testPurgeKeepsRejectingOldStamps() {
        long stamp = registry.readStamp();
        registry.mutate("a", () -> {});
        clock.advance(Duration.ofMinutes(2));

        registry.purgeExpired();

        assertThat(registry.size()).isZero();
        assertThat(registry.applyIfUnchanged("a", stamp, () -> {})).isFalse();
        assertThat(registry.applyIfUnchanged("a", registry.readStamp(), () -> {})).isTrue();
    }

    @Test
    void testPurgeTriggeredByThreshold() {
        KeyVersionRegistry small = new KeyVersionRegistry(clock, Duration.ofSeconds(1), 10);
        for (int i = 0; i < 10; i++) {
            small.mutate("key" + i, () -> {});
        }
        clock.advance(Duration.ofSeconds(5));

        small.mutate("trigger", () -> {});

        assertThat(small.size()).isEqualTo(1);
    }
}
