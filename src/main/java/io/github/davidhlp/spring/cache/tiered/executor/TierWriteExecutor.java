package io.github.davidhlp.spring.cache.tiered.executor;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 按键分通道执行二级/三级缓存写入。
 * <p>
 * 同一个键的任务按提交顺序串行执行（先进先出），不同键之间并行。
 * 批量任务同时占用多个通道。
 * 这样晚到的回填不会落在更新的删除之后。
 * </p>
 * <p>
 * 同步模式下任务在调用线程执行，同一通道由分段锁串行化。
 * </p>
 */
@Slf4j
public class TierWriteExecutor {

    private static final String THREAD_NAME_PREFIX = "tiered-cache-write-";
    private static final int STRIPES = 64;

    private final ExecutorService executorService;
    private final ConcurrentHashMap<String, CompletableFuture<Void>> lanes = new ConcurrentHashMap<>();
    private final ReentrantLock[] stripes;
    private final boolean async;

    /**
     * 创建异步执行器
     */
    public static TierWriteExecutor async() {
        return new TierWriteExecutor(createExecutor(), true);
    }

    /**
     * 创建同步执行器，任务在调用线程执行
     */
    public static TierWriteExecutor direct() {
        return new TierWriteExecutor(null, false);
    }

    TierWriteExecutor(ExecutorService executorService, boolean async) {
        this.executorService = executorService;
        this.async = async;
        this.stripes = new ReentrantLock[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
        log.info("TierWriteExecutor initialized: async={}", async);
    }

    private static ExecutorService createExecutor() {
        return new ThreadPoolExecutor(
                4,
                4,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new WriteThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    public boolean isAsync() {
        return async;
    }

    /**
     * 在指定通道上提交任务
     *
     * @param lane 通道键，通常为缓存键
     * @param task 写入任务，异常会被记录但不会传播
     * @return 任务完成时完成的 future
     */
    public CompletableFuture<Void> submit(String lane, Runnable task) {
        return submit(Collections.singletonList(lane), task);
    }

    /**
     * 在多个通道上提交同一个任务（批量写入）
     *
     * <p>任务在这些通道上之前提交的任务全部完成后执行，之后提交到这些通道的任务排在它后面。
     *
     * @param laneKeys 通道键
     * @param task 写入任务
     * @return 任务完成时完成的 future
     */
    public CompletableFuture<Void> submit(Collection<String> laneKeys, Runnable task) {
        Set<String> keys = new LinkedHashSet<>(laneKeys);
        String description = describe(keys);
        if (!async) {
            runDirect(keys, description, task);
            return CompletableFuture.completedFuture(null);
        }

        Runnable guarded = () -> runQuietly(description, task);
        CompletableFuture<Void> future;
        synchronized (lanes) {
            List<CompletableFuture<Void>> tails = new ArrayList<>();
            for (String key : keys) {
                CompletableFuture<Void> tail = lanes.get(key);
                if (tail != null) {
                    tails.add(tail);
                }
            }
            CompletableFuture<Void> previous = tails.isEmpty()
                    ? CompletableFuture.completedFuture(null)
                    : CompletableFuture.allOf(tails.toArray(new CompletableFuture<?>[0]));
            future = previous.handle((r, t) -> null).thenRunAsync(guarded, executorService);
            for (String key : keys) {
                lanes.put(key, future);
            }
        }

        CompletableFuture<Void> registered = future;
        registered.whenComplete((result, throwable) -> {
            for (String key : keys) {
                lanes.remove(key, registered);
            }
            if (throwable != null) {
                log.warn("Tier write dropped: lane={}, error={}", description, throwable.getMessage());
            }
        });
        return registered;
    }

    /**
     * 等待指定通道上已提交的任务完成，用于读己之写
     *
     * @param lane 通道键
     * @param timeout 最长等待时间
     * @return 是否在时限内完成
     */
    public boolean awaitLane(String lane, Duration timeout) {
        CompletableFuture<Void> tail = lanes.get(lane);
        if (tail == null) {
            return true;
        }
        try {
            tail.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.debug("Timed out waiting for pending writes: lane={}", lane);
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 等待当前所有通道执行完毕
     *
     * @param timeout 最长等待时间
     * @return 是否在时限内全部完成
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!lanes.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            CompletableFuture<?>[] pending = lanes.values().toArray(new CompletableFuture<?>[0]);
            try {
                CompletableFuture.allOf(pending).get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                // 任务失败已在完成回调中记录
                log.debug("Pending tier write completed exceptionally: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    /**
     * 获取当前尚未完成的通道数量
     */
    public int getPendingLanes() {
        return lanes.size();
    }

    /**
     * 通道上是否还有未完成的写入
     */
    public boolean hasPendingWrites(String lane) {
        return lanes.containsKey(lane);
    }

    /**
     * 关闭执行器，等待已提交的写入完成
     */
    public void shutdown() {
        if (executorService == null) {
            return;
        }
        log.info("Shutting down tier write executor, pendingLanes={}", lanes.size());
        awaitQuiescence(Duration.ofSeconds(10));
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
                log.warn("Tier write executor did not terminate gracefully, forced shutdown");
            } else {
                log.info("Tier write executor shut down successfully");
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runDirect(Set<String> keys, String description, Runnable task) {
        // 按下标顺序加锁，避免批量任务之间死锁
        TreeSet<Integer> indexes = new TreeSet<>();
        for (String key : keys) {
            indexes.add((key.hashCode() & 0x7fffffff) % STRIPES);
        }
        List<ReentrantLock> held = new ArrayList<>(indexes.size());
        try {
            for (Integer index : indexes) {
                ReentrantLock lock = stripes[index];
                lock.lock();
                held.add(lock);
            }
            runQuietly(description, task);
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    private static String describe(Set<String> keys) {
        if (keys.size() == 1) {
            return keys.iterator().next();
        }
        return "batch(" + keys.size() + " keys)";
    }

    private void runQuietly(String lane, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            log.error("Failed to execute tier write: lane={}", lane, ex);
        }
    }

    private static final class WriteThreadFactory implements ThreadFactory {
        private final AtomicInteger threadNumber = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, THREAD_NAME_PREFIX + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
