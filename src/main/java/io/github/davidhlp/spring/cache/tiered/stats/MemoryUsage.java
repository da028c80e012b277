package io.github.davidhlp.spring.cache.tiered.stats;

/** 一级缓存内存估算（字节） */
public record MemoryUsage(long used, long available, long total) {

    public static MemoryUsage of(long used, long total) {
        return new MemoryUsage(used, Math.max(0, total - used), total);
    }
}
