package io.github.davidhlp.spring.cache.tiered.stats;

/**
 * 缓存层统计快照
 *
 * @param hitRate hits / (hits + misses)，无访问时为 0
 */
public record TierStats(long hits, long misses, long errors, long writes, double hitRate) {

    public static double hitRate(long hits, long misses) {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
