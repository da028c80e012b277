package io.github.davidhlp.spring.cache.tiered.core;

/**
 * 缓存操作相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // 超长键哈希后的前缀
    public static final String HASHED_KEY_PREFIX = "hashed:";

    // 标签集合键前缀（二级缓存）
    public static final String TAG_KEY_PREFIX = "__tag__:";

    // 日志中键的最大展示长度
    public static final int MAX_LOG_KEY_LENGTH = 100;

    // 操作类型常量
    public static final class Operations {
        public static final String GET = "get";
        public static final String SET = "set";
        public static final String DELETE = "delete";
        public static final String MGET = "mget";
        public static final String MSET = "mset";
        public static final String DELETE_BY_TAGS = "deleteByTags";
        public static final String DELETE_BY_PATTERN = "deleteByPattern";
        public static final String PROMOTE = "promote";
        public static final String WARM = "warmCache";
        public static final String FLUSH = "flush";
        public static final String HEALTH_CHECK = "health_check";

        private Operations() {}
    }

    // 缓存层标识
    public static final class CacheLayers {
        public static final String LOCAL = "local";

        private CacheLayers() {}
    }
}
