package io.github.davidhlp.spring.cache.tiered.stats;

import java.util.concurrent.atomic.LongAdder;

/**
 * 单个缓存层的计数器
 *
 * <p>hits + misses 等于该层实际应答的键数；调用失败或被熔断短路只计入 errors，
 * 应答了但无法解码的值同时计入 misses 和 errors。
 */
public class TierStatistics {

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder writes = new LongAdder();

    public void recordHit() {
        hits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordError() {
        errors.increment();
    }

    public void recordWrite() {
        writes.increment();
    }

    public long getHits() {
        return hits.sum();
    }

    public long getMisses() {
        return misses.sum();
    }

    public long getErrors() {
        return errors.sum();
    }

    public TierStats snapshot() {
        long h = hits.sum();
        long m = misses.sum();
        return new TierStats(h, m, errors.sum(), writes.sum(), TierStats.hitRate(h, m));
    }
}
