package io.github.davidhlp.spring.cache.tiered.breaker;

import io.github.davidhlp.spring.cache.tiered.tier.CacheTierException;
import io.github.davidhlp.spring.cache.tiered.tier.CacheTierTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 带超时的远程调用执行器
 *
 * <p>每次二级/三级缓存调用都提交到独立线程池，由 Resilience4j {@link TimeLimiter} 限时等待，
 * 超时视为失败并取消调用。
 */
@Slf4j
public class TierCallExecutor implements AutoCloseable {

    private static final String THREAD_NAME_PREFIX = "tiered-cache-io-";

    private final ExecutorService executorService;

    public TierCallExecutor() {
        this(createExecutor());
    }

    public TierCallExecutor(ExecutorService executorService) {
        this.executorService = executorService;
    }

    private static ExecutorService createExecutor() {
        return new ThreadPoolExecutor(
                4,
                64,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new TierCallThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * 为某一缓存层创建限时器，超时后中断正在执行的调用
     */
    public static TimeLimiter timeLimiter(String tierName, Duration timeout) {
        return TimeLimiter.of(tierName, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    /**
     * 在时限内执行调用
     *
     * @param tierName 缓存层名称
     * @param operation 操作名称
     * @param call 调用
     * @param timeLimiter 限时器
     * @return 调用结果
     * @throws CacheTierException 调用失败、超时或被中断
     */
    public <T> T execute(String tierName, String operation, Callable<T> call, TimeLimiter timeLimiter) {
        try {
            return timeLimiter.executeFutureSupplier(() -> executorService.submit(call));
        } catch (CacheTierException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new CacheTierTimeoutException(
                    tierName, operation, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
        } catch (RejectedExecutionException e) {
            throw new CacheTierException(tierName, "No capacity to execute '" + operation + "' on tier '" + tierName + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheTierException(tierName, "Interrupted while waiting for '" + operation + "' on tier '" + tierName + "'", e);
        } catch (Exception e) {
            throw new CacheTierException(tierName,
                    "Operation '" + operation + "' on tier '" + tierName + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
                log.warn("Tier call executor did not terminate gracefully, forced shutdown");
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class TierCallThreadFactory implements ThreadFactory {
        private final AtomicInteger threadNumber = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, THREAD_NAME_PREFIX + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
