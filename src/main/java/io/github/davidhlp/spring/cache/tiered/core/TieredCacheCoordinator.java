package io.github.davidhlp.spring.cache.tiered.core;

import io.github.davidhlp.spring.cache.tiered.breaker.GuardedCacheTier;
import io.github.davidhlp.spring.cache.tiered.breaker.TierCallExecutor;
import io.github.davidhlp.spring.cache.tiered.breaker.TierCircuitBreaker;
import io.github.davidhlp.spring.cache.tiered.config.TieredCacheProperties;
import io.github.davidhlp.spring.cache.tiered.core.CacheConstants.Operations;
import io.github.davidhlp.spring.cache.tiered.core.entity.CacheEntry;
import io.github.davidhlp.spring.cache.tiered.core.version.KeyVersionRegistry;
import io.github.davidhlp.spring.cache.tiered.executor.TierWriteExecutor;
import io.github.davidhlp.spring.cache.tiered.local.BoundedLruCache;
import io.github.davidhlp.spring.cache.tiered.management.CacheKeyManager;
import io.github.davidhlp.spring.cache.tiered.serialization.EncodedValue;
import io.github.davidhlp.spring.cache.tiered.serialization.SerializationException;
import io.github.davidhlp.spring.cache.tiered.serialization.ValueCodec;
import io.github.davidhlp.spring.cache.tiered.stats.CacheHealth;
import io.github.davidhlp.spring.cache.tiered.stats.CacheStatistics;
import io.github.davidhlp.spring.cache.tiered.stats.HealthStatus;
import io.github.davidhlp.spring.cache.tiered.stats.LocalTierStats;
import io.github.davidhlp.spring.cache.tiered.stats.MemoryUsage;
import io.github.davidhlp.spring.cache.tiered.stats.OperationTimer;
import io.github.davidhlp.spring.cache.tiered.stats.PerformanceMetrics;
import io.github.davidhlp.spring.cache.tiered.stats.TierStatistics;
import io.github.davidhlp.spring.cache.tiered.support.CacheExceptionHandler;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTier;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;
import io.github.davidhlp.spring.cache.tiered.tier.DurableCacheStore;
import io.github.davidhlp.spring.cache.tiered.tier.TierEntry;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiPredicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import static io.github.davidhlp.spring.cache.tiered.management.CacheKeyManager.formatKeyForLog;

/**
 * 三级缓存协调器
 *
 * <p>读路径：一级缓存 → 二级缓存（熔断保护）→ 三级持久存储（熔断保护），命中后逐级回填。
 * 写路径：一级缓存同步写入，二级/三级按键通道异步写入，失败只记录不抛出。
 *
 * <p>回填通过 {@link KeyVersionRegistry} 做版本校验，读开始之后发生的写入/删除总是优先。
 * 每个二级/三级写入任务携带发起时的键版本，执行时若该键已有更新的修改则跳过，
 * 因此并发的 set/delete 即使入队顺序颠倒，远程层也不会复活旧值。
 *
 * <p>一级缓存保存调用方传入的对象引用，get 返回同一个引用；调用方不应在写入后修改该对象。
 *
 * <p>对外只传播两类异常：参数校验失败 {@link CacheValidationException}，
 * 以及 getOrCompute 回调失败 {@link ValueComputationException}。
 */
@Slf4j
public class TieredCacheCoordinator implements AutoCloseable {

    private final TieredCacheProperties properties;
    private final BoundedLruCache<String, CacheEntry> localCache;
    private final GuardedCacheTier remoteTier;
    private final GuardedCacheTier durableTier;
    private final ValueCodec codec;
    private final CacheKeyManager keyManager;
    private final KeyVersionRegistry versions;
    private final TierCallExecutor callExecutor;
    private final TierWriteExecutor writeExecutor;
    private final Clock clock;

    private final TierStatistics l1Stats = new TierStatistics();
    private final TierStatistics l2Stats = new TierStatistics();
    private final TierStatistics l3Stats = new TierStatistics();
    private final OperationTimer timer = new OperationTimer();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TieredCacheCoordinator(
            TieredCacheProperties properties, CacheTier remoteTier, DurableCacheStore durableStore, ValueCodec codec) {
        this(properties, remoteTier, durableStore, codec, new TierCallExecutor(),
                properties.isAsyncWrites() ? TierWriteExecutor.async() : TierWriteExecutor.direct(),
                Clock.systemUTC());
    }

    public TieredCacheCoordinator(
            TieredCacheProperties properties,
            CacheTier remoteTier,
            DurableCacheStore durableStore,
            ValueCodec codec,
            TierCallExecutor callExecutor,
            TierWriteExecutor writeExecutor,
            Clock clock) {
        this.properties = properties;
        this.codec = codec;
        this.callExecutor = callExecutor;
        this.writeExecutor = writeExecutor;
        this.clock = clock;
        this.keyManager = new CacheKeyManager(properties.getMaxKeyLength());
        this.versions = new KeyVersionRegistry(clock, properties.getVersionRetention());
        this.localCache = new BoundedLruCache<>(
                CacheConstants.CacheLayers.LOCAL, properties.getL1MaxSize(), clock, CacheEntry::getSizeBytes);

        this.remoteTier = new GuardedCacheTier(
                remoteTier, createBreaker(remoteTier.name()), callExecutor, properties.getTierTimeout());
        this.durableTier = new GuardedCacheTier(
                durableStore,
                properties.isGuardDurableStore() ? createBreaker(durableStore.name()) : null,
                callExecutor,
                properties.getTierTimeout());

        log.info("Tiered cache initialized: l1MaxSize={}, remote={}, durable={}, asyncWrites={}",
                properties.getL1MaxSize(), remoteTier.name(), durableStore.name(), writeExecutor.isAsync());
    }

    private TierCircuitBreaker createBreaker(String name) {
        return new TierCircuitBreaker(
                name,
                properties.getFailureThreshold(),
                properties.getBreakerCooldown(),
                properties.getBreakerBackoffMultiplier(),
                properties.getMaxBreakerCooldown(),
                clock);
    }

    // ---------------------------------------------------------------- 读取

    /**
     * 分层读取
     *
     * @param key 缓存键
     * @return 读取结果，未命中时 hit 为 false；持久层失败时 error 非空
     * @throws CacheValidationException 键为空
     */
    public <T> CacheResult<T> get(String key) {
        long start = System.nanoTime();
        try {
            return doGet(keyManager.normalize(key));
        } finally {
            timer.recordGet(System.nanoTime() - start);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> CacheResult<T> doGet(String key) {
        long stamp = versions.readStamp();

        CacheEntry local = localCache.get(key);
        if (local != null) {
            l1Stats.recordHit();
            if (log.isDebugEnabled()) {
                log.debug("Cache hit: tier=L1, key={}", formatKeyForLog(key));
            }
            return CacheResult.hit((T) local.getValue(), CacheSource.L1);
        }
        l1Stats.recordMiss();

        // 等待本键尚未落地的写入，保证读到自己刚写入或删除的结果
        writeExecutor.awaitLane(key, properties.getTierTimeout());

        TierEntry remote = readRemote(key);
        if (remote != null) {
            Object value = decode(remote, remoteTier.name(), l2Stats);
            if (value != null) {
                l2Stats.recordHit();
                promoteToLocal(key, stamp, value, remote, remote.getExpiresAt());
                if (log.isDebugEnabled()) {
                    log.debug("Cache hit: tier=L2, key={}", formatKeyForLog(key));
                }
                return CacheResult.hit((T) value, CacheSource.L2);
            }
        }

        TierEntry durable;
        try {
            durable = durableTier.get(key);
        } catch (CacheTierException e) {
            l3Stats.recordError();
            CacheExceptionHandler.logException(Operations.GET, e, durableTier.name(), formatKeyForLog(key));
            return CacheResult.miss(CacheExceptionHandler.describe(durableTier.name(), e));
        }

        Instant now = clock.instant();
        if (durable == null) {
            l3Stats.recordMiss();
            return CacheResult.miss();
        }
        if (durable.isExpired(now)) {
            l3Stats.recordMiss();
            deleteExpiredDurable(key, stamp);
            return CacheResult.miss();
        }

        Object value;
        try {
            value = codec.decode(durable.getValue());
        } catch (SerializationException e) {
            l3Stats.recordMiss();
            l3Stats.recordError();
            CacheExceptionHandler.logException(Operations.GET, e, durableTier.name(), formatKeyForLog(key));
            return CacheResult.miss(CacheExceptionHandler.describe(durableTier.name(), e));
        }
        l3Stats.recordHit();
        promoteToLocal(key, stamp, value, durable, durable.getExpiresAt());
        promoteToRemote(Collections.singletonList(durable), stamp, now);
        if (log.isDebugEnabled()) {
            log.debug("Cache hit: tier=L3, key={}", formatKeyForLog(key));
        }
        return CacheResult.hit((T) value, CacheSource.L3);
    }

    /**
     * 批量读取，结果与输入位置一一对应
     *
     * <p>一级缓存逐键查找，未命中的键对二级、三级缓存各发起一次批量读取。
     */
    @SuppressWarnings("unchecked")
    public <T> List<CacheResult<T>> mget(List<String> keys) {
        timer.recordOperation();
        List<String> normalized = new ArrayList<>(keys.size());
        for (String key : keys) {
            normalized.add(keyManager.normalize(key));
        }

        long stamp = versions.readStamp();
        Map<String, CacheResult<T>> resolved = new LinkedHashMap<>();
        Set<String> pending = new LinkedHashSet<>();
        for (String key : normalized) {
            if (resolved.containsKey(key) || pending.contains(key)) {
                continue;
            }
            CacheEntry local = localCache.get(key);
            if (local != null) {
                l1Stats.recordHit();
                resolved.put(key, CacheResult.hit((T) local.getValue(), CacheSource.L1));
            } else {
                l1Stats.recordMiss();
                pending.add(key);
            }
        }

        if (!pending.isEmpty()) {
            for (String key : pending) {
                writeExecutor.awaitLane(key, properties.getTierTimeout());
            }
            resolveFromRemote(pending, stamp, resolved);
        }
        if (!pending.isEmpty()) {
            resolveFromDurable(pending, stamp, resolved);
        }

        List<CacheResult<T>> results = new ArrayList<>(normalized.size());
        for (String key : normalized) {
            CacheResult<T> result = resolved.get(key);
            results.add(result != null ? result : CacheResult.miss());
        }
        return results;
    }

    @SuppressWarnings("unchecked")
    private <T> void resolveFromRemote(Set<String> pending, long stamp, Map<String, CacheResult<T>> resolved) {
        Map<String, TierEntry> found;
        try {
            found = remoteTier.mget(new ArrayList<>(pending));
        } catch (CacheTierException e) {
            l2Stats.recordError();
            CacheExceptionHandler.logException(Operations.MGET, e, remoteTier.name(), pending.size());
            return;
        }

        for (String key : new ArrayList<>(pending)) {
            TierEntry entry = found.get(key);
            if (entry == null) {
                l2Stats.recordMiss();
                continue;
            }
            Object value = decode(entry, remoteTier.name(), l2Stats);
            if (value == null) {
                continue;
            }
            l2Stats.recordHit();
            promoteToLocal(key, stamp, value, entry, entry.getExpiresAt());
            resolved.put(key, CacheResult.hit((T) value, CacheSource.L2));
            pending.remove(key);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void resolveFromDurable(Set<String> pending, long stamp, Map<String, CacheResult<T>> resolved) {
        Map<String, TierEntry> found;
        try {
            found = durableTier.mget(new ArrayList<>(pending));
        } catch (CacheTierException e) {
            l3Stats.recordError();
            CacheExceptionHandler.logException(Operations.MGET, e, durableTier.name(), pending.size());
            String error = CacheExceptionHandler.describe(durableTier.name(), e);
            for (String key : pending) {
                resolved.put(key, CacheResult.miss(error));
            }
            return;
        }

        Instant now = clock.instant();
        List<TierEntry> promoted = new ArrayList<>();
        for (String key : pending) {
            TierEntry entry = found.get(key);
            if (entry == null) {
                l3Stats.recordMiss();
                continue;
            }
            if (entry.isExpired(now)) {
                l3Stats.recordMiss();
                deleteExpiredDurable(key, stamp);
                continue;
            }
            try {
                Object value = codec.decode(entry.getValue());
                l3Stats.recordHit();
                promoteToLocal(key, stamp, value, entry, entry.getExpiresAt());
                promoted.add(entry);
                resolved.put(key, CacheResult.hit((T) value, CacheSource.L3));
            } catch (SerializationException e) {
                l3Stats.recordMiss();
                l3Stats.recordError();
                CacheExceptionHandler.logException(Operations.MGET, e, durableTier.name(), formatKeyForLog(key));
                resolved.put(key, CacheResult.miss(CacheExceptionHandler.describe(durableTier.name(), e)));
            }
        }
        promoteToRemote(promoted, stamp, now);
    }

    private TierEntry readRemote(String key) {
        try {
            TierEntry entry = remoteTier.get(key);
            if (entry == null) {
                l2Stats.recordMiss();
            }
            return entry;
        } catch (CacheTierException e) {
            l2Stats.recordError();
            CacheExceptionHandler.logException(Operations.GET, e, remoteTier.name(), formatKeyForLog(key));
            return null;
        }
    }

    /**
     * 解码远程层数据，失败计为该层的一次未命中和一次错误
     */
    private Object decode(TierEntry entry, String tierName, TierStatistics stats) {
        try {
            return codec.decode(entry.getValue());
        } catch (SerializationException e) {
            stats.recordMiss();
            stats.recordError();
            CacheExceptionHandler.logException(Operations.GET, e, tierName, formatKeyForLog(entry.getKey()));
            return null;
        }
    }

    // ---------------------------------------------------------------- 回填

    /**
     * 回填一级缓存，存活时间不超过来源层的剩余寿命
     */
    private boolean promoteToLocal(String key, long stamp, Object value, TierEntry source, Instant expiresAt) {
        Instant now = clock.instant();
        Duration ttl = properties.getL1DefaultTtl();
        if (expiresAt != null) {
            if (!expiresAt.isAfter(now)) {
                return false;
            }
            Duration remaining = Duration.between(now, expiresAt);
            if (remaining.compareTo(ttl) < 0) {
                ttl = remaining;
            }
        }
        CacheEntry entry = CacheEntry.builder()
                .key(key)
                .value(value)
                .tags(source.getTags() != null ? source.getTags() : Collections.emptySet())
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .sizeBytes(source.getValue().length)
                .build();
        Duration l1Ttl = ttl;
        return versions.applyIfUnchanged(key, stamp, () -> localCache.put(key, entry, l1Ttl));
    }

    /**
     * 三级缓存命中后异步回填二级缓存，过期时间取二级默认 TTL 与剩余时间的较小值
     */
    private void promoteToRemote(List<TierEntry> entries, long stamp, Instant now) {
        if (entries.isEmpty()) {
            return;
        }
        List<TierEntry> capped = new ArrayList<>(entries.size());
        List<String> keys = new ArrayList<>(entries.size());
        Instant remoteLimit = now.plus(properties.getL2DefaultTtl());
        for (TierEntry entry : entries) {
            Instant expiresAt = entry.getExpiresAt() == null || entry.getExpiresAt().isAfter(remoteLimit)
                    ? remoteLimit
                    : entry.getExpiresAt();
            capped.add(entry.toBuilder().expiresAt(expiresAt).build());
            keys.add(entry.getKey());
        }

        writeExecutor.submit(keys, () -> {
            List<TierEntry> fresh = new ArrayList<>(capped.size());
            for (TierEntry entry : capped) {
                if (!versions.isStale(entry.getKey(), stamp)) {
                    fresh.add(entry);
                }
            }
            if (fresh.isEmpty()) {
                return;
            }
            boolean ok = CacheExceptionHandler.safeExecute(
                    () -> {
                        if (fresh.size() == 1) {
                            remoteTier.set(fresh.get(0), null);
                        } else {
                            remoteTier.mset(fresh, null);
                        }
                    },
                    Operations.PROMOTE, remoteTier.name(), fresh.size());
            recordWrite(l2Stats, ok);
        });
    }

    private void deleteExpiredDurable(String key, long stamp) {
        writeExecutor.submit(key, () -> {
            if (versions.isStale(key, stamp)) {
                return;
            }
            CacheExceptionHandler.safeExecute(
                    () -> durableTier.delete(key), Operations.DELETE, durableTier.name(), formatKeyForLog(key));
            if (log.isDebugEnabled()) {
                log.debug("Removed expired durable entry: key={}", formatKeyForLog(key));
            }
        });
    }

    // ---------------------------------------------------------------- 写入

    public void set(String key, Object value) {
        set(key, value, CacheOptions.defaults());
    }

    /**
     * 写入所有缓存层
     *
     * <p>一级缓存同步写入；二级、三级缓存异步尽力写入，失败只记录。
     *
     * @throws CacheValidationException 键为空、值为 null、值过大或无法序列化
     */
    public void set(String key, Object value, CacheOptions options) {
        long start = System.nanoTime();
        try {
            CacheOptions opts = options != null ? options : CacheOptions.defaults();
            String normalized = keyManager.normalize(key);
            PreparedWrite write = prepare(normalized, value, opts, clock.instant());

            long version = versions.mutate(normalized, () -> localCache.put(normalized, write.local(), write.l1Ttl()));
            l1Stats.recordWrite();

            writeExecutor.submit(normalized, () -> {
                if (isSuperseded(normalized, version)) {
                    return;
                }
                writeThrough(write);
            });
        } finally {
            timer.recordSet(System.nanoTime() - start);
        }
    }

    /**
     * 批量写入
     *
     * <p>所有条目先完成校验；一级缓存逐键写入，二级、三级缓存各一次批量写入，逐键尽力而为。
     */
    public void mset(Map<String, ?> entries, CacheOptions options) {
        timer.recordOperation();
        if (entries == null || entries.isEmpty()) {
            return;
        }
        CacheOptions opts = options != null ? options : CacheOptions.defaults();
        Instant now = clock.instant();

        Map<String, PreparedWrite> writes = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : entries.entrySet()) {
            String normalized = keyManager.normalize(entry.getKey());
            writes.put(normalized, prepare(normalized, entry.getValue(), opts, now));
        }

        Map<String, Long> submitted = new LinkedHashMap<>();
        for (PreparedWrite write : writes.values()) {
            submitted.put(write.key(),
                    versions.mutate(write.key(), () -> localCache.put(write.key(), write.local(), write.l1Ttl())));
            l1Stats.recordWrite();
        }

        Duration l2Ttl = resolveTtl(opts.getTtl(), properties.getL2DefaultTtl());
        Duration l3Ttl = resolveTtl(opts.getTtl(), properties.getL3DefaultTtl());

        writeExecutor.submit(writes.keySet(), () -> {
            List<TierEntry> tierEntries = new ArrayList<>(writes.size());
            for (PreparedWrite write : writes.values()) {
                if (!isSuperseded(write.key(), submitted.get(write.key()))) {
                    tierEntries.add(write.remote());
                }
            }
            if (tierEntries.isEmpty()) {
                return;
            }
            boolean remoteOk = CacheExceptionHandler.safeExecute(
                    () -> remoteTier.mset(tierEntries, l2Ttl), Operations.MSET, remoteTier.name(), tierEntries.size());
            recordWrite(l2Stats, remoteOk);
            boolean durableOk = CacheExceptionHandler.safeExecute(
                    () -> durableTier.mset(tierEntries, l3Ttl), Operations.MSET, durableTier.name(), tierEntries.size());
            recordWrite(l3Stats, durableOk);
        });
    }

    /**
     * 读取，未命中时执行回调计算并写入所有缓存层
     *
     * @param computeFn 计算回调，每次调用最多执行一次
     * @return 命中时为缓存结果；计算得到时 source 为 {@link CacheSource#COMPUTED}
     * @throws ValueComputationException 回调失败
     */
    public <T> CacheResult<T> getOrCompute(String key, Callable<? extends T> computeFn, CacheOptions options) {
        CacheResult<T> cached = get(key);
        if (cached.hit()) {
            return cached;
        }

        T value;
        try {
            value = computeFn.call();
        } catch (Exception e) {
            throw new ValueComputationException(key, e);
        }
        if (value == null) {
            log.debug("Computed null value, not cached: key={}", formatKeyForLog(key));
            return CacheResult.computed(null);
        }
        set(key, value, options);
        return CacheResult.computed(value);
    }

    private PreparedWrite prepare(String key, Object value, CacheOptions options, Instant now) {
        if (value == null) {
            throw new CacheValidationException("Cache value must not be null: key=" + formatKeyForLog(key));
        }
        EncodedValue encoded;
        try {
            encoded = codec.encode(value, options.isCompress());
        } catch (SerializationException e) {
            throw new CacheValidationException(
                    "Cache value cannot be serialized: key=" + formatKeyForLog(key) + ", " + e.getMessage(), e);
        }
        if (encoded.rawSize() > properties.getMaxValueBytes()) {
            throw new CacheValidationException("Cache value too large: key=" + formatKeyForLog(key)
                    + ", size=" + encoded.rawSize() + ", max=" + properties.getMaxValueBytes());
        }

        Duration l1Ttl = resolveTtl(options.getTtl(), properties.getL1DefaultTtl());
        Duration l2Ttl = resolveTtl(options.getTtl(), properties.getL2DefaultTtl());
        Duration l3Ttl = resolveTtl(options.getTtl(), properties.getL3DefaultTtl());

        CacheEntry local = CacheEntry.builder()
                .key(key)
                .value(value)
                .tags(options.getTags())
                .createdAt(now)
                .expiresAt(now.plus(l1Ttl))
                .sizeBytes(encoded.rawSize())
                .build();
        TierEntry remote = TierEntry.builder()
                .key(key)
                .value(encoded.bytes())
                .tags(options.getTags())
                .createdAt(now)
                .expiresAt(now.plus(l3Ttl))
                .build();
        return new PreparedWrite(key, local, remote, l1Ttl, l2Ttl, l3Ttl);
    }

    /**
     * 任务执行前该键又被修改过，更新的修改已入队或已执行，旧任务不再写入远程层
     */
    private boolean isSuperseded(String key, long version) {
        if (versions.isSuperseded(key, version)) {
            if (log.isDebugEnabled()) {
                log.debug("Skipped superseded tier write: key={}, version={}", formatKeyForLog(key), version);
            }
            return true;
        }
        return false;
    }

    private void writeThrough(PreparedWrite write) {
        String logKey = formatKeyForLog(write.key());
        boolean remoteOk = CacheExceptionHandler.safeExecute(
                () -> remoteTier.set(write.remote(), write.l2Ttl()), Operations.SET, remoteTier.name(), logKey);
        recordWrite(l2Stats, remoteOk);
        boolean durableOk = CacheExceptionHandler.safeExecute(
                () -> durableTier.set(write.remote(), write.l3Ttl()), Operations.SET, durableTier.name(), logKey);
        recordWrite(l3Stats, durableOk);
    }

    private static void recordWrite(TierStatistics stats, boolean success) {
        if (success) {
            stats.recordWrite();
        } else {
            stats.recordError();
        }
    }

    private static Duration resolveTtl(Duration requested, Duration defaultTtl) {
        return requested != null && !requested.isZero() && !requested.isNegative() ? requested : defaultTtl;
    }

    // ---------------------------------------------------------------- 删除

    /**
     * 从所有缓存层删除，幂等；远程层失败只记录
     */
    public void delete(String key) {
        timer.recordOperation();
        String normalized = keyManager.normalize(key);
        long version = versions.mutate(normalized, () -> localCache.remove(normalized));

        String logKey = formatKeyForLog(normalized);
        writeExecutor.submit(normalized, () -> {
            if (isSuperseded(normalized, version)) {
                return;
            }
            boolean remoteOk = CacheExceptionHandler.safeExecute(
                    () -> remoteTier.delete(normalized), Operations.DELETE, remoteTier.name(), logKey);
            if (!remoteOk) {
                l2Stats.recordError();
            }
            boolean durableOk = CacheExceptionHandler.safeExecute(
                    () -> durableTier.delete(normalized), Operations.DELETE, durableTier.name(), logKey);
            if (!durableOk) {
                l3Stats.recordError();
            }
        });
    }

    /**
     * 按标签批量失效
     *
     * @return 被失效的不同键的数量
     */
    public int deleteByTags(Collection<String> tags) {
        timer.recordOperation();
        if (tags == null || tags.isEmpty()) {
            return 0;
        }
        Set<String> tagSet = new LinkedHashSet<>(tags);
        Set<String> invalidated = invalidateLocal((key, entry) -> entry.hasAnyTag(tagSet));

        // 先让已提交的写入落地，避免失效之后被旧写入复活
        writeExecutor.awaitQuiescence(properties.getTierTimeout());
        invalidated.addAll(bulkDelete(remoteTier, l2Stats, Operations.DELETE_BY_TAGS,
                () -> remoteTier.deleteByTags(tagSet), tagSet));
        invalidated.addAll(bulkDelete(durableTier, l3Stats, Operations.DELETE_BY_TAGS,
                () -> durableTier.deleteByTags(tagSet), tagSet));
        invalidateLocalKeys(invalidated);

        log.info("Invalidated {} keys by tags {}", invalidated.size(), tagSet);
        return invalidated.size();
    }

    /**
     * 按 glob 模式（{@code *}、{@code ?}）批量失效
     *
     * @return 被失效的不同键的数量
     */
    public int deleteByPattern(String glob) {
        timer.recordOperation();
        if (glob == null || glob.isEmpty()) {
            throw new CacheValidationException("Pattern must not be empty");
        }
        Pattern pattern = CacheKeyManager.globToRegex(glob);
        Set<String> invalidated = invalidateLocal((key, entry) -> pattern.matcher(key).matches());

        writeExecutor.awaitQuiescence(properties.getTierTimeout());
        invalidated.addAll(bulkDelete(remoteTier, l2Stats, Operations.DELETE_BY_PATTERN,
                () -> remoteTier.deleteByPattern(glob), glob));
        invalidated.addAll(bulkDelete(durableTier, l3Stats, Operations.DELETE_BY_PATTERN,
                () -> durableTier.deleteByPattern(glob), glob));
        invalidateLocalKeys(invalidated);

        log.info("Invalidated {} keys by pattern '{}'", invalidated.size(), glob);
        return invalidated.size();
    }

    private Set<String> invalidateLocal(BiPredicate<String, CacheEntry> predicate) {
        Set<String> invalidated = new LinkedHashSet<>();
        for (String key : localCache.keys()) {
            CacheEntry entry = localCache.peek(key);
            if (entry != null && predicate.test(key, entry)) {
                versions.mutate(key, () -> localCache.remove(key));
                invalidated.add(key);
            }
        }
        return invalidated;
    }

    /**
     * 远程层返回的键同样从一级缓存清除，覆盖回填时没有携带标签的副本
     */
    private void invalidateLocalKeys(Set<String> keys) {
        for (String key : keys) {
            versions.mutate(key, () -> localCache.remove(key));
        }
    }

    private Set<String> bulkDelete(
            CacheTier tier, TierStatistics stats, String operation,
            Supplier<Set<String>> call, Object context) {
        try {
            Set<String> deleted = call.get();
            return deleted != null ? deleted : Collections.emptySet();
        } catch (CacheTierException e) {
            stats.recordError();
            CacheExceptionHandler.logException(operation, e, tier.name(), context);
            return Collections.emptySet();
        }
    }

    // ---------------------------------------------------------------- 预热

    /**
     * 从持久层加载访问次数最高的条目到一级、二级缓存
     *
     * @return 实际加载到一级缓存的条目数，不超过一级缓存容量
     */
    public int warmCache(WarmOptions options) {
        timer.recordOperation();
        WarmOptions opts = options != null ? options : WarmOptions.builder().build();
        int limit = Math.min(opts.getMaxEntries(), properties.getL1MaxSize());
        if (limit <= 0) {
            return 0;
        }

        // 先让已提交的写入落地，持久层读到的不会比一级缓存旧
        writeExecutor.awaitQuiescence(properties.getTierTimeout());
        long stamp = versions.readStamp();
        Instant now = clock.instant();
        List<TierEntry> candidates;
        try {
            candidates = new ArrayList<>(durableTier.findWarmCandidates(opts.getTags(), limit, now));
        } catch (CacheTierException e) {
            l3Stats.recordError();
            CacheExceptionHandler.logException(Operations.WARM, e, durableTier.name(), opts.getTags());
            return 0;
        }

        candidates.removeIf(entry -> entry.isExpired(now));
        candidates.sort(Comparator.comparingLong(TierEntry::getAccessCount).reversed());
        if (candidates.size() > limit) {
            candidates = candidates.subList(0, limit);
        }

        // 按访问次数升序插入，最热的条目位于 LRU 头部
        List<TierEntry> loaded = new ArrayList<>(candidates.size());
        for (int i = candidates.size() - 1; i >= 0; i--) {
            TierEntry entry = candidates.get(i);
            if (localCache.contains(entry.getKey()) || writeExecutor.hasPendingWrites(entry.getKey())) {
                continue;
            }
            Object value;
            try {
                value = codec.decode(entry.getValue());
            } catch (SerializationException e) {
                l3Stats.recordError();
                CacheExceptionHandler.logException(Operations.WARM, e, durableTier.name(),
                        formatKeyForLog(entry.getKey()));
                continue;
            }
            if (promoteToLocal(entry.getKey(), stamp, value, entry, entry.getExpiresAt())) {
                loaded.add(entry);
            }
        }
        promoteToRemote(loaded, stamp, now);

        log.info("Cache warming completed: tags={}, requested={}, candidates={}, loaded={}",
                opts.getTags(), opts.getMaxEntries(), candidates.size(), loaded.size());
        return loaded.size();
    }

    // ---------------------------------------------------------------- 管理

    /**
     * 清空一级缓存和二级缓存命名空间，持久层保持不变
     */
    public void flush() {
        timer.recordOperation();
        versions.flush(localCache::clear);
        writeExecutor.awaitQuiescence(properties.getTierTimeout());
        Set<String> removed = bulkDelete(remoteTier, l2Stats, Operations.FLUSH,
                () -> remoteTier.deleteByPattern("*"), "*");
        log.info("Cache flushed: remoteKeysRemoved={}", removed.size());
    }

    /**
     * 健康检查：一级缓存始终可用，远程层通过 ping 探测
     */
    public CacheHealth healthCheck() {
        long start = System.nanoTime();
        boolean local = !closed.get();
        boolean remote = CacheExceptionHandler.safeExecute(remoteTier::ping, Operations.HEALTH_CHECK, remoteTier.name());
        boolean durable = CacheExceptionHandler.safeExecute(durableTier::ping, Operations.HEALTH_CHECK, durableTier.name());

        HealthStatus status;
        if (!local || (!remote && !durable)) {
            status = HealthStatus.UNHEALTHY;
        } else if (!remote || !durable) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }
        long latencyMillis = (System.nanoTime() - start) / 1_000_000;
        return new CacheHealth(status, local, remote, durable, latencyMillis);
    }

    public CacheStatistics getStatistics() {
        LocalTierStats l1 = new LocalTierStats(
                l1Stats.getHits(),
                l1Stats.getMisses(),
                l1Stats.snapshot().hitRate(),
                localCache.size(),
                localCache.capacity(),
                localCache.getTotalEvictions(),
                MemoryUsage.of(localCache.weightedSize(), properties.getL1MaxMemoryBytes()));
        TierCircuitBreaker durableBreaker = durableTier.getCircuitBreaker();
        return new CacheStatistics(
                l1,
                l2Stats.snapshot(),
                l3Stats.snapshot(),
                remoteTier.getCircuitBreaker().snapshot(),
                durableBreaker != null ? durableBreaker.snapshot() : null);
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return timer.snapshot();
    }

    /**
     * 等待所有异步写入落地
     *
     * @return 是否在时限内完成
     */
    public boolean awaitPendingWrites(Duration timeout) {
        return writeExecutor.awaitQuiescence(timeout);
    }

    /**
     * 一级缓存中是否存在该键（不改变访问顺序）
     */
    public boolean containsLocal(String key) {
        return localCache.contains(keyManager.normalize(key));
    }

    public int localSize() {
        return localCache.size();
    }

    public TierCircuitBreaker getRemoteCircuitBreaker() {
        return remoteTier.getCircuitBreaker();
    }

    public TierCircuitBreaker getDurableCircuitBreaker() {
        return durableTier.getCircuitBreaker();
    }

    /**
     * 排空异步写入并关闭执行器，可重复调用
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing tiered cache, pendingLanes={}", writeExecutor.getPendingLanes());
        writeExecutor.shutdown();
        callExecutor.close();
    }

    /** 校验通过、待写入的条目 */
    private record PreparedWrite(
            String key, CacheEntry local, TierEntry remote, Duration l1Ttl, Duration l2Ttl, Duration l3Ttl) {}
}
