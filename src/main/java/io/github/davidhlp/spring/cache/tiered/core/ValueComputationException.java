package io.github.davidhlp.spring.cache.tiered.core;

import org.springframework.core.NestedRuntimeException;

/** getOrCompute 回调执行失败，是协调器唯一向调用方传播的错误 */
public class ValueComputationException extends NestedRuntimeException {

    private final String key;

    public ValueComputationException(String key, Throwable cause) {
        super("Failed to compute value for key '" + key + "'", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
