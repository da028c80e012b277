package io.github.davidhlp.spring.cache.tiered.tier;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * 持久存储层（三级缓存）
 *
 * <p>存储是通用表而不是缓存引擎，过期由协调器判断：单键读取时返回的条目可能已过期，
 * 协调器负责过滤并删除。
 */
public interface DurableCacheStore extends CacheTier {

    /**
     * 查找用于缓存预热的候选条目
     *
     * @param tags 标签过滤，为空表示不过滤
     * @param limit 最大数量
     * @param now 当前时间，已过期的条目不返回
     * @return 按访问次数降序排列的条目
     */
    List<TierEntry> findWarmCandidates(Collection<String> tags, int limit, Instant now);
}
