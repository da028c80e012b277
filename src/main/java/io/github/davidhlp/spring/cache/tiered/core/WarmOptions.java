package io.github.davidhlp.spring.cache.tiered.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/** 缓存预热选项 */
@Value
@Builder
public class WarmOptions {

    /** 标签过滤，为空表示全部 */
    @Singular Set<String> tags;

    @Builder.Default int maxEntries = 100;
}
