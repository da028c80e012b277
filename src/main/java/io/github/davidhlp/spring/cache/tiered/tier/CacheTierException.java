package io.github.davidhlp.spring.cache.tiered.tier;

import org.springframework.core.NestedRuntimeException;

/**
 * 二级/三级缓存访问失败
 *
 * <p>连接错误、超时、熔断短路都以此异常（或其子类）表示，由协调器统一捕获。
 */
public class CacheTierException extends NestedRuntimeException {

    private final String tierName;

    public CacheTierException(String tierName, String msg) {
        super(msg);
        this.tierName = tierName;
    }

    public CacheTierException(String tierName, String msg, Throwable cause) {
        super(msg, cause);
        this.tierName = tierName;
    }

    public String getTierName() {
        return tierName;
    }
}
