package io.github.davidhlp.spring.cache.tiered.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * 写入选项
 *
 * <p>ttl 为 null 时各层使用各自的默认存活时间；指定时对所有层生效。
 */
@Value
@Builder
public class CacheOptions {

    private static final CacheOptions DEFAULTS = CacheOptions.builder().build();

    Duration ttl;

    @Singular Set<String> tags;

    /** 强制压缩远程层数据 */
    boolean compress;

    public static CacheOptions defaults() {
        return DEFAULTS;
    }

    public static CacheOptions ttl(Duration ttl) {
        return CacheOptions.builder().ttl(ttl).build();
    }
}
