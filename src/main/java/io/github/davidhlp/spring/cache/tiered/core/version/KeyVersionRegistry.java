package io.github.davidhlp.spring.cache.tiered.core.version;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 键版本登记表
 *
 * <p>每次写入、删除、失效都会推进键的版本，且与一级缓存的修改在同一个原子区间内完成。
 * 读操作开始时取得读戳，之后的回填（promotion）只有在读戳之后没有发生修改时才会生效，
 * 从而保证旧值不会覆盖新值。
 *
 * <p>版本记录在保留期后清理；被清理记录的最大版本成为新的下限，读戳低于下限的回填一律拒绝。
 */
@Slf4j
public class KeyVersionRegistry {

    private static final int DEFAULT_PURGE_THRESHOLD = 10_000;

    private final AtomicLong sequence = new AtomicLong();

    private final ConcurrentHashMap<String, Mutation> mutations = new ConcurrentHashMap<>();

    /** flush 与回填互斥，保证 flush 之后不会出现旧数据 */
    private final ReentrantReadWriteLock flushLock = new ReentrantReadWriteLock();

    private final AtomicBoolean purging = new AtomicBoolean(false);

    private final Clock clock;

    private final Duration retention;

    private final int purgeThreshold;

    /** 读戳不高于该值的回填全部拒绝 */
    private volatile long floor;

    public KeyVersionRegistry(Clock clock, Duration retention) {
        this(clock, retention, DEFAULT_PURGE_THRESHOLD);
    }

    public KeyVersionRegistry(Clock clock, Duration retention, int purgeThreshold) {
        this.clock = clock;
        this.retention = retention;
        this.purgeThreshold = purgeThreshold;
    }

    /**
     * 获取读戳，在访问任何缓存层之前调用
     */
    public long readStamp() {
        return sequence.get();
    }

    /**
     * 推进键版本并在同一原子区间内执行修改
     *
     * @param key 缓存键
     * @param action 一级缓存修改
     * @return 新版本号
     */
    public long mutate(String key, Runnable action) {
        long[] version = new long[1];
        flushLock.readLock().lock();
        try {
            mutations.compute(key, (k, previous) -> {
                action.run();
                version[0] = sequence.incrementAndGet();
                return new Mutation(version[0], clock.millis());
            });
        } finally {
            flushLock.readLock().unlock();
        }
        purgeIfNeeded();
        return version[0];
    }

    /**
     * 读戳之后键未被修改时执行回填
     *
     * @param key 缓存键
     * @param readStamp 读操作开始时的读戳
     * @param action 回填动作
     * @return 是否执行
     */
    public boolean applyIfUnchanged(String key, long readStamp, Runnable action) {
        boolean[] applied = new boolean[1];
        flushLock.readLock().lock();
        try {
            if (readStamp < floor) {
                return false;
            }
            mutations.compute(key, (k, current) -> {
                if (current == null || current.version() <= readStamp) {
                    action.run();
                    applied[0] = true;
                }
                return current;
            });
        } finally {
            flushLock.readLock().unlock();
        }
        if (!applied[0] && log.isDebugEnabled()) {
            log.debug("Skipped stale promotion: key={}, readStamp={}", key, readStamp);
        }
        return applied[0];
    }

    /**
     * 键是否在读戳之后被修改
     */
    public boolean isStale(String key, long readStamp) {
        if (readStamp < floor) {
            return true;
        }
        Mutation current = mutations.get(key);
        return current != null && current.version() > readStamp;
    }

    /**
     * 键在某次修改之后是否又被修改过
     *
     * <p>只比较键自身的版本记录，不受下限影响；记录已被清理或 flush 时视为未被取代。
     *
     * @param key 缓存键
     * @param version {@link #mutate} 返回的版本号
     */
    public boolean isSuperseded(String key, long version) {
        Mutation current = mutations.get(key);
        return current != null && current.version() > version;
    }

    /**
     * 全局失效：之前取得的所有读戳都不再允许回填
     *
     * @param action 与失效原子执行的清理动作
     */
    public void flush(Runnable action) {
        flushLock.writeLock().lock();
        try {
            floor = sequence.incrementAndGet();
            action.run();
            mutations.clear();
        } finally {
            flushLock.writeLock().unlock();
        }
    }

    public int size() {
        return mutations.size();
    }

    /**
     * 清理超过保留期的版本记录，并以清理掉的最大版本抬高下限
     */
    public void purgeExpired() {
        long cutoff = clock.millis() - retention.toMillis();
        long maxPurged = 0;
        int purged = 0;
        Iterator<Map.Entry<String, Mutation>> iterator = mutations.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Mutation> entry = iterator.next();
            Mutation mutation = entry.getValue();
            if (mutation.recordedAtMillis() < cutoff && mutations.remove(entry.getKey(), mutation)) {
                maxPurged = Math.max(maxPurged, mutation.version());
                purged++;
            }
        }
        if (maxPurged > 0) {
            raiseFloor(maxPurged);
        }
        if (purged > 0) {
            log.debug("Purged {} expired key versions, remaining={}", purged, mutations.size());
        }
    }

    private synchronized void raiseFloor(long candidate) {
        if (candidate > floor) {
            floor = candidate;
        }
    }

    private void purgeIfNeeded() {
        if (mutations.size() <= purgeThreshold || !purging.compareAndSet(false, true)) {
            return;
        }
        try {
            purgeExpired();
        } finally {
            purging.set(false);
        }
    }

    /** 单次修改记录 */
    record Mutation(long version, long recordedAtMillis) {}
}
