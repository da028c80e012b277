package io.github.davidhlp.spring.cache.tiered.tier.redis;

import io.github.davidhlp.spring.cache.tiered.core.CacheConstants;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTier;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;
import io.github.davidhlp.spring.cache.tiered.tier.TierEntry;

import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisStringCommands;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.types.Expiration;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 基于 Spring Data Redis 的二级缓存
 *
 * <p>所有键带命名空间前缀；标签索引保存在 Redis 集合 {@code <namespace>__tag__:<tag>} 中，
 * 集合的过期时间不短于其中任何成员。批量写入使用管道，模式删除使用 SCAN。
 *
 * <p>读取时在同一管道内执行 GET 与 PTTL，返回的条目带有剩余过期时间，回填一级缓存时不会超出二级缓存的寿命。
 */
@Slf4j
public class RedisCacheTier implements CacheTier {

    public static final String NAME = "redis";

    private static final int SCAN_COUNT = 500;
    private static final int DELETE_BATCH_SIZE = 200;

    private final RedisTemplate<String, byte[]> valueTemplate;
    private final StringRedisTemplate indexTemplate;
    private final String namespace;
    private final Duration defaultTtl;
    private final Clock clock;

    public RedisCacheTier(
            RedisTemplate<String, byte[]> valueTemplate,
            StringRedisTemplate indexTemplate,
            String namespace,
            Duration defaultTtl,
            Clock clock) {
        this.valueTemplate = valueTemplate;
        this.indexTemplate = indexTemplate;
        this.namespace = namespace != null ? namespace : "";
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TierEntry get(String key) {
        return mget(Collections.singletonList(key)).get(key);
    }

    @Override
    public void set(TierEntry entry, Duration ttl) {
        Duration effectiveTtl = effectiveTtl(entry, ttl);
        if (effectiveTtl == null) {
            delete(entry.getKey());
            return;
        }
        execute("set", () -> {
            valueTemplate.opsForValue().set(redisKey(entry.getKey()), entry.getValue(), effectiveTtl);
            indexTags(entry, effectiveTtl);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        execute("delete", () -> valueTemplate.delete(redisKey(key)));
    }

    @Override
    public Map<String, TierEntry> mget(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyMap();
        }
        String operation = keys.size() == 1 ? "get" : "mget";
        List<Object> results = execute(operation, () -> valueTemplate.executePipelined((RedisCallback<Object>) connection -> {
            for (String key : keys) {
                byte[] redisKey = bytes(redisKey(key));
                connection.stringCommands().get(redisKey);
                connection.keyCommands().pTtl(redisKey);
            }
            return null;
        }));

        Map<String, TierEntry> found = new HashMap<>();
        if (results == null) {
            return found;
        }
        Instant now = clock.instant();
        for (int i = 0; i < keys.size() && 2 * i < results.size(); i++) {
            if (!(results.get(2 * i) instanceof byte[] value)) {
                continue;
            }
            Object ttl = 2 * i + 1 < results.size() ? results.get(2 * i + 1) : null;
            found.put(keys.get(i), TierEntry.builder()
                    .key(keys.get(i))
                    .value(value)
                    .expiresAt(expiresAt(now, ttl))
                    .build());
        }
        return found;
    }

    /**
     * PTTL 结果转换为过期时间：-1 表示不过期，其他负值表示键已不存在
     */
    private static Instant expiresAt(Instant now, Object pttl) {
        if (!(pttl instanceof Number millis) || millis.longValue() == -1L) {
            return null;
        }
        return now.plusMillis(Math.max(0L, millis.longValue()));
    }

    @Override
    public void mset(Collection<TierEntry> entries, Duration ttl) {
        if (entries.isEmpty()) {
            return;
        }
        List<TierEntry> writable = new ArrayList<>(entries.size());
        List<Duration> ttls = new ArrayList<>(entries.size());
        for (TierEntry entry : entries) {
            Duration effectiveTtl = effectiveTtl(entry, ttl);
            if (effectiveTtl != null) {
                writable.add(entry);
                ttls.add(effectiveTtl);
            }
        }
        if (writable.isEmpty()) {
            return;
        }

        execute("mset", () -> valueTemplate.executePipelined((RedisCallback<Object>) connection -> {
            for (int i = 0; i < writable.size(); i++) {
                TierEntry entry = writable.get(i);
                Duration entryTtl = ttls.get(i);
                connection.stringCommands().set(
                        bytes(redisKey(entry.getKey())),
                        entry.getValue(),
                        Expiration.from(entryTtl),
                        RedisStringCommands.SetOption.upsert());
                Duration indexTtl = entryTtl.compareTo(defaultTtl) > 0 ? entryTtl : defaultTtl;
                for (String tag : entry.getTags()) {
                    byte[] tagKey = bytes(tagKey(tag));
                    connection.setCommands().sAdd(tagKey, bytes(entry.getKey()));
                    // 管道中无法读取当前 TTL，取条目 TTL 与默认 TTL 的较大值
                    connection.keyCommands().expire(tagKey, indexTtl.getSeconds());
                }
            }
            return null;
        }));
        log.debug("Pipelined {} entries into redis", writable.size());
    }

    @Override
    public Set<String> deleteByTags(Collection<String> tags) {
        Set<String> members = new LinkedHashSet<>();
        List<String> tagKeys = new ArrayList<>(tags.size());
        for (String tag : tags) {
            String tagKey = tagKey(tag);
            tagKeys.add(tagKey);
            Set<String> tagged = execute("deleteByTags", () -> indexTemplate.opsForSet().members(tagKey));
            if (tagged != null) {
                members.addAll(tagged);
            }
        }

        Set<String> deleted = deleteKeys(members);
        execute("deleteByTags", () -> indexTemplate.delete(tagKeys));
        log.debug("Deleted {} redis keys by tags {}", deleted.size(), tags);
        return deleted;
    }

    @Override
    public Set<String> deleteByPattern(String glob) {
        String match = namespace + glob;
        String tagPrefix = namespace + CacheConstants.TAG_KEY_PREFIX;
        List<String> matched = new ArrayList<>();
        execute("deleteByPattern", () -> valueTemplate.execute((RedisCallback<Void>) connection -> {
            ScanOptions scanOptions = ScanOptions.scanOptions().match(match).count(SCAN_COUNT).build();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(scanOptions)) {
                while (cursor.hasNext()) {
                    String redisKey = new String(cursor.next(), StandardCharsets.UTF_8);
                    if (!redisKey.startsWith(tagPrefix)) {
                        matched.add(redisKey.substring(namespace.length()));
                    }
                }
            }
            return null;
        }));

        Set<String> deleted = deleteKeys(matched);
        log.debug("Deleted {} redis keys by pattern '{}'", deleted.size(), glob);
        return deleted;
    }

    @Override
    public void ping() {
        String reply = execute("ping", () -> valueTemplate.execute((RedisCallback<String>) connection -> connection.ping()));
        if (!"PONG".equalsIgnoreCase(reply)) {
            throw new CacheTierException(NAME, "Redis ping returned unexpected result: " + reply);
        }
    }

    /**
     * 管道删除，只返回确实存在并被删除的键
     */
    private Set<String> deleteKeys(Collection<String> keys) {
        Set<String> deleted = new LinkedHashSet<>();
        if (keys.isEmpty()) {
            return deleted;
        }
        List<String> ordered = new ArrayList<>(keys);
        for (int start = 0; start < ordered.size(); start += DELETE_BATCH_SIZE) {
            List<String> batch = ordered.subList(start, Math.min(start + DELETE_BATCH_SIZE, ordered.size()));
            List<Object> results = execute("delete", () -> valueTemplate.executePipelined((RedisCallback<Object>) connection -> {
                for (String key : batch) {
                    connection.keyCommands().del(bytes(redisKey(key)));
                }
                return null;
            }));
            for (int i = 0; i < batch.size(); i++) {
                Object result = results != null && i < results.size() ? results.get(i) : null;
                if (result instanceof Number number && number.longValue() > 0) {
                    deleted.add(batch.get(i));
                }
            }
        }
        return deleted;
    }

    private void indexTags(TierEntry entry, Duration ttl) {
        for (String tag : entry.getTags()) {
            String tagKey = tagKey(tag);
            indexTemplate.opsForSet().add(tagKey, entry.getKey());
            Long currentSeconds = indexTemplate.getExpire(tagKey);
            if (currentSeconds == null || currentSeconds < ttl.getSeconds()) {
                indexTemplate.expire(tagKey, ttl);
            }
        }
    }

    /**
     * 计算实际 TTL：显式 TTL 优先，其次为条目剩余时间，最后为默认值；已过期返回 null
     */
    private Duration effectiveTtl(TierEntry entry, Duration ttl) {
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            return ttl;
        }
        if (entry.getExpiresAt() != null) {
            Duration remaining = Duration.between(clock.instant(), entry.getExpiresAt());
            return remaining.isZero() || remaining.isNegative() ? null : remaining;
        }
        return defaultTtl;
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new CacheTierException(NAME, "Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }

    String redisKey(String key) {
        return namespace + key;
    }

    String tagKey(String tag) {
        return namespace + CacheConstants.TAG_KEY_PREFIX + tag;
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
