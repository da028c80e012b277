package io.github.davidhlp.spring.cache.tiered.core.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * 一级缓存中的条目，value 为反序列化后的对象
 */
@Value
@Builder
public class CacheEntry {

    String key;

    Object value;

    @Singular Set<String> tags;

    Instant createdAt;

    /** 过期时间，null 表示不过期 */
    Instant expiresAt;

    /** 序列化后的大小（未压缩），用于内存估算 */
    long sizeBytes;

    public boolean hasAnyTag(Iterable<String> candidates) {
        for (String tag : candidates) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
