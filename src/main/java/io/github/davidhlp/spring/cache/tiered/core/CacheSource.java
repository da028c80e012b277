package io.github.davidhlp.spring.cache.tiered.core;

/** 读取结果的来源 */
public enum CacheSource {
    L1,
    L2,
    L3,
    /** 所有层都未命中 */
    NONE,
    /** 未命中后由回调计算得到 */
    COMPUTED
}
