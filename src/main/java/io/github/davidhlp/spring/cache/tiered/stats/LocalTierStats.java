package io.github.davidhlp.spring.cache.tiered.stats;

/** 一级缓存统计快照 */
public record LocalTierStats(
        long hits,
        long misses,
        double hitRate,
        int entries,
        int capacity,
        long evictions,
        MemoryUsage memory) {}
