package io.github.davidhlp.spring.cache.tiered.core;

/** 参数校验失败，在访问任何缓存层之前同步抛出 */
public class CacheValidationException extends IllegalArgumentException {

    public CacheValidationException(String message) {
        super(message);
    }

    public CacheValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
