package io.github.davidhlp.spring.cache.tiered.stats;

import java.util.concurrent.atomic.LongAdder;

/**
 * 记录 get/set 耗时与操作总数
 */
public class OperationTimer {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final LongAdder getCount = new LongAdder();
    private final LongAdder getNanos = new LongAdder();
    private final LongAdder setCount = new LongAdder();
    private final LongAdder setNanos = new LongAdder();
    private final LongAdder operations = new LongAdder();

    public void recordGet(long elapsedNanos) {
        getCount.increment();
        getNanos.add(elapsedNanos);
        operations.increment();
    }

    public void recordSet(long elapsedNanos) {
        setCount.increment();
        setNanos.add(elapsedNanos);
        operations.increment();
    }

    public void recordOperation() {
        operations.increment();
    }

    public PerformanceMetrics snapshot() {
        return new PerformanceMetrics(
                average(getNanos.sum(), getCount.sum()),
                average(setNanos.sum(), setCount.sum()),
                operations.sum());
    }

    private static double average(long totalNanos, long count) {
        return count == 0 ? 0.0 : totalNanos / NANOS_PER_MILLI / count;
    }
}
