package io.github.davidhlp.spring.cache.tiered.tier;

import java.time.Duration;

/** 缓存层调用超过时限 */
public class CacheTierTimeoutException extends CacheTierException {

    public CacheTierTimeoutException(String tierName, String operation, Duration timeout) {
        super(tierName, "Operation '" + operation + "' on tier '" + tierName + "' timed out after "
                + timeout.toMillis() + "ms");
    }
}
