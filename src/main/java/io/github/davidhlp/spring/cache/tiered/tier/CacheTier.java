package io.github.davidhlp.spring.cache.tiered.tier;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 远程缓存层适配器
 *
 * <p>二级缓存（网络缓存）和三级缓存（持久存储）共用的能力集合。
 * 所有方法失败时抛出 {@link CacheTierException}，协调器从不假设调用成功。
 */
public interface CacheTier {

    /**
     * 缓存层名称，用于日志和统计
     */
    String name();

    /**
     * 读取单个条目
     *
     * @param key 缓存键
     * @return 条目，不存在返回 null
     */
    TierEntry get(String key);

    /**
     * 写入单个条目
     *
     * @param entry 条目
     * @param ttl 存活时间，null 表示使用条目自身的 expiresAt
     */
    void set(TierEntry entry, Duration ttl);

    /**
     * 删除单个条目，不存在时不报错
     */
    void delete(String key);

    /**
     * 批量读取
     *
     * @param keys 缓存键
     * @return 命中的条目，键为缓存键；未命中的键不出现在结果中
     */
    Map<String, TierEntry> mget(List<String> keys);

    /**
     * 批量写入，逐键尽力而为
     */
    void mset(Collection<TierEntry> entries, Duration ttl);

    /**
     * 删除带有任一标签的条目
     *
     * @return 被删除的键
     */
    Set<String> deleteByTags(Collection<String> tags);

    /**
     * 删除匹配 glob 模式（{@code *}、{@code ?}）的条目
     *
     * @return 被删除的键
     */
    Set<String> deleteByPattern(String glob);

    /**
     * 健康探测，不可用时抛出异常
     */
    void ping();
}
