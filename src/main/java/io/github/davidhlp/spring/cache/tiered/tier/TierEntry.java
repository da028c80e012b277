package io.github.davidhlp.spring.cache.tiered.tier;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * 二级/三级缓存中存储的条目
 *
 * <p>value 为序列化（可能已压缩）后的字节。适配器只负责存取，不修改条目内容。
 */
@Value
@Builder(toBuilder = true)
public class TierEntry {

    String key;

    byte[] value;

    @Singular Set<String> tags;

    Instant createdAt;

    /** 过期时间，null 表示不过期 */
    Instant expiresAt;

    /** 历史访问次数，仅持久层维护 */
    long accessCount;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
