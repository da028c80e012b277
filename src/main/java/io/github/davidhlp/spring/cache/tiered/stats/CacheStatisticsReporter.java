package io.github.davidhlp.spring.cache.tiered.stats;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 定期输出缓存统计日志
 */
@Slf4j
public class CacheStatisticsReporter implements AutoCloseable {

    private final Supplier<CacheStatistics> statisticsSupplier;
    private final Supplier<PerformanceMetrics> metricsSupplier;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public CacheStatisticsReporter(
            Supplier<CacheStatistics> statisticsSupplier,
            Supplier<PerformanceMetrics> metricsSupplier,
            Duration interval) {
        this.statisticsSupplier = statisticsSupplier;
        this.metricsSupplier = metricsSupplier;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null || interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "tiered-cache-stats");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::report, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Cache statistics reporter started: interval={}", interval);
    }

    /**
     * 输出一次统计
     */
    public void report() {
        try {
            CacheStatistics stats = statisticsSupplier.get();
            PerformanceMetrics metrics = metricsSupplier.get();
            log.info(
                    "Cache statistics: l1[hits={}, misses={}, hitRate={}, entries={}/{}, evictions={}, memoryUsed={}], "
                            + "l2[hits={}, misses={}, errors={}, writes={}, breaker={}], l3[hits={}, misses={}, errors={}, writes={}], "
                            + "avgGet={}ms, avgSet={}ms, operations={}",
                    stats.l1().hits(), stats.l1().misses(), String.format("%.2f", stats.l1().hitRate()),
                    stats.l1().entries(), stats.l1().capacity(), stats.l1().evictions(), stats.l1().memory().used(),
                    stats.l2().hits(), stats.l2().misses(), stats.l2().errors(), stats.l2().writes(),
                    stats.remoteBreaker() != null ? stats.remoteBreaker().state() : "NONE",
                    stats.l3().hits(), stats.l3().misses(), stats.l3().errors(), stats.l3().writes(),
                    String.format("%.3f", metrics.averageGetTime()), String.format("%.3f", metrics.averageSetTime()),
                    metrics.totalOperations());
        } catch (RuntimeException e) {
            log.warn("Failed to report cache statistics: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Cache statistics reporter stopped");
        }
    }
}
