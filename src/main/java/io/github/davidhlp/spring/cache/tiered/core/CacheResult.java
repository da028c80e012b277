package io.github.davidhlp.spring.cache.tiered.core;

/**
 * 读取结果
 *
 * @param value 值，未命中为 null
 * @param hit 是否命中
 * @param source 来源层
 * @param error 持久层失败时的错误描述，格式为 {@code <tier>: <message>}
 */
public record CacheResult<T>(T value, boolean hit, CacheSource source, String error) {

    public static <T> CacheResult<T> hit(T value, CacheSource source) {
        return new CacheResult<>(value, true, source, null);
    }

    public static <T> CacheResult<T> miss() {
        return new CacheResult<>(null, false, CacheSource.NONE, null);
    }

    public static <T> CacheResult<T> miss(String error) {
        return new CacheResult<>(null, false, CacheSource.NONE, error);
    }

    public static <T> CacheResult<T> computed(T value) {
        return new CacheResult<>(value, false, CacheSource.COMPUTED, null);
    }

    public boolean hasError() {
        return error != null;
    }
}
