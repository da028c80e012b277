package io.github.davidhlp.spring.cache.tiered.local;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 固定容量的本地 LRU 缓存（一级缓存）
 *
 * <p>哈希索引 + 双向链表，所有操作 O(1)。链表头部为最近访问的节点，尾部为最久未访问的节点。
 *
 * <p>过期条目只在访问时惰性删除，不做后台清理。
 *
 * <p>读操作同样会修改链表顺序，因此所有操作都持有同一把互斥锁。
 *
 * @param <K> 键类型
 * @param <V> 值类型
 */
@Slf4j
public class BoundedLruCache<K, V> {

    private final int capacity;

    private final Clock clock;

    /** 值的权重计算器，用于估算内存占用 */
    private final ToLongFunction<V> weigher;

    /** 元素映射表，用于快速查找节点 */
    private final Map<K, Node<K, V>> nodeMap;

    /** 头哨兵节点（最近访问） */
    private final Node<K, V> head;

    /** 尾哨兵节点（最久未访问） */
    private final Node<K, V> tail;

    private final ReentrantLock lock = new ReentrantLock();

    /** 当前总权重 */
    private long weightedSize;

    /** 容量淘汰次数 */
    private long totalEvictions;

    /** 过期删除次数 */
    private long totalExpirations;

    @Getter private final String name;

    public BoundedLruCache(String name, int capacity) {
        this(name, capacity, Clock.systemUTC(), value -> 1L);
    }

    public BoundedLruCache(String name, int capacity, Clock clock, ToLongFunction<V> weigher) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.name = name;
        this.capacity = capacity;
        this.clock = clock;
        this.weigher = weigher;
        this.nodeMap = new HashMap<>(Math.min(capacity, 1 << 16) * 4 / 3 + 1);

        this.head = new Node<>(null, null, Long.MAX_VALUE);
        this.tail = new Node<>(null, null, Long.MAX_VALUE);
        head.next = tail;
        tail.prev = head;
    }

    /**
     * 获取元素，命中时提升为最近访问
     *
     * @param key 键
     * @return 值，不存在或已过期返回 null
     */
    public V get(K key) {
        if (key == null) {
            return null;
        }

        lock.lock();
        try {
            Node<K, V> node = nodeMap.get(key);
            if (node == null) {
                return null;
            }
            if (node.isExpired(clock.millis())) {
                expireNodeUnsafe(node);
                return null;
            }
            moveToHeadUnsafe(node);
            return node.value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 查看元素但不改变访问顺序
     *
     * @param key 键
     * @return 值，不存在或已过期返回 null
     */
    public V peek(K key) {
        if (key == null) {
            return null;
        }

        lock.lock();
        try {
            Node<K, V> node = nodeMap.get(key);
            if (node == null || node.isExpired(clock.millis())) {
                return null;
            }
            return node.value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 添加或替换元素
     *
     * <p>新键且容量已满时，先淘汰最久未访问的节点再插入。
     *
     * @param key 键
     * @param value 值
     * @param ttl 存活时间，null 或非正数表示不过期
     */
    public void put(K key, V value, Duration ttl) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }

        long expiresAt = expiresAt(ttl);
        lock.lock();
        try {
            Node<K, V> existingNode = nodeMap.get(key);
            if (existingNode != null) {
                weightedSize -= existingNode.weight;
                existingNode.value = value;
                existingNode.expiresAt = expiresAt;
                existingNode.weight = weigher.applyAsLong(value);
                weightedSize += existingNode.weight;
                moveToHeadUnsafe(existingNode);
                if (log.isDebugEnabled()) {
                    log.debug("Updated local entry: cache={}, key={}", name, key);
                }
                return;
            }

            if (nodeMap.size() >= capacity) {
                evictEldestUnsafe();
            }

            Node<K, V> newNode = new Node<>(key, value, expiresAt);
            newNode.weight = weigher.applyAsLong(value);
            insertAfterUnsafe(head, newNode);
            nodeMap.put(key, newNode);
            weightedSize += newNode.weight;
            if (log.isDebugEnabled()) {
                log.debug("Added local entry: cache={}, key={}, size={}", name, key, nodeMap.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除元素
     *
     * @param key 键
     * @return 被移除的值，不存在返回 null
     */
    public V remove(K key) {
        if (key == null) {
            return null;
        }

        lock.lock();
        try {
            Node<K, V> node = nodeMap.remove(key);
            if (node == null) {
                return null;
            }
            unlinkUnsafe(node);
            weightedSize -= node.weight;
            return node.value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 判断是否包含未过期的键，不改变访问顺序
     */
    public boolean contains(K key) {
        return peek(key) != null;
    }

    /**
     * 按访问顺序返回所有键的快照（最近访问在前）
     */
    public List<K> keys() {
        lock.lock();
        try {
            List<K> keys = new ArrayList<>(nodeMap.size());
            for (Node<K, V> node = head.next; node != tail; node = node.next) {
                keys.add(node.key);
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return nodeMap.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long weightedSize() {
        lock.lock();
        try {
            return weightedSize;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalEvictions() {
        lock.lock();
        try {
            return totalEvictions;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalExpirations() {
        lock.lock();
        try {
            return totalExpirations;
        } finally {
            lock.unlock();
        }
    }

    /** 清空所有元素 */
    public void clear() {
        lock.lock();
        try {
            nodeMap.clear();
            head.next = tail;
            tail.prev = head;
            weightedSize = 0;
            if (log.isDebugEnabled()) {
                log.debug("Cleared all local entries: cache={}", name);
            }
        } finally {
            lock.unlock();
        }
    }

    private long expiresAt(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Long.MAX_VALUE;
        }
        return clock.millis() + ttl.toMillis();
    }

    /** 淘汰最久未访问的节点（需要持有锁） */
    private void evictEldestUnsafe() {
        Node<K, V> eldest = tail.prev;
        if (eldest == head) {
            return;
        }
        nodeMap.remove(eldest.key);
        unlinkUnsafe(eldest);
        weightedSize -= eldest.weight;
        totalEvictions++;

        if (log.isDebugEnabled()) {
            log.debug("Evicted eldest local entry: cache={}, key={}, totalEvictions={}",
                    name, eldest.key, totalEvictions);
        }
    }

    /** 删除已过期节点（需要持有锁） */
    private void expireNodeUnsafe(Node<K, V> node) {
        nodeMap.remove(node.key);
        unlinkUnsafe(node);
        weightedSize -= node.weight;
        totalExpirations++;
        if (log.isDebugEnabled()) {
            log.debug("Expired local entry removed on access: cache={}, key={}", name, node.key);
        }
    }

    private void moveToHeadUnsafe(Node<K, V> node) {
        if (head.next == node) {
            return;
        }
        unlinkUnsafe(node);
        insertAfterUnsafe(head, node);
    }

    private void insertAfterUnsafe(Node<K, V> prev, Node<K, V> node) {
        node.next = prev.next;
        node.prev = prev;
        prev.next.prev = node;
        prev.next = node;
    }

    private void unlinkUnsafe(Node<K, V> node) {
        node.prev.next = node.next;
        node.next.prev = node.prev;
        node.prev = null;
        node.next = null;
    }

    /** 双向链表节点 */
    static final class Node<K, V> {
        final K key;
        V value;
        long expiresAt;
        long weight;
        Node<K, V> prev;
        Node<K, V> next;

        Node(K key, V value, long expiresAt) {
            this.key = key;
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
