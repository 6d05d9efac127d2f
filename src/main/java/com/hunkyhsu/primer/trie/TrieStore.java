package com.hunkyhsu.primer.trie;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TrieStore - 基于持久化 Trie 的并发 KV 存储
 *
 * <p>保存"当前版本"的 Trie 根，负责在多个写者之间仲裁：
 * <ul>
 *   <li>rootLock 只保护 root 引用的读取和替换，持有时间极短</li>
 *   <li>writeLock 串行化写者（单写者），保证每次写都基于最新版本，不丢更新</li>
 * </ul>
 * 读者拿到根之后在快照上查找，不持有任何锁，不会被写者阻塞。
 *
 * @author hunkyhsu
 * @see Trie
 */
public class TrieStore {

    private static final Logger logger = LoggerFactory.getLogger(TrieStore.class);

    private final ReentrantLock rootLock;

    private final ReentrantLock writeLock;

    private Trie root;

    public TrieStore() {
        this(new Trie());
    }

    public TrieStore(Trie initial) {
        this.rootLock = new ReentrantLock();
        this.writeLock = new ReentrantLock();
        this.root = initial;
        logger.info("TrieStore initialized (empty={})", initial.isEmpty());
    }

    public <T> Optional<ValueGuard<T>> get(String key, Class<T> type) {
        Trie snapshot = snapshot();
        return snapshot.get(key, type).map(value -> new ValueGuard<>(snapshot, value));
    }

    public <T> void put(String key, T value) {
        writeLock.lock();
        try {
            Trie next = snapshot().put(key, value);
            publish(next);
            logger.debug("Put key '{}'", key);
        } finally {
            writeLock.unlock();
        }
    }

    public void remove(String key) {
        writeLock.lock();
        try {
            Trie current = snapshot();
            Trie next = current.remove(key);
            if (next == current) {
                logger.debug("Remove key '{}' skipped (not present)", key);
                return;
            }
            publish(next);
            logger.debug("Removed key '{}'", key);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 当前版本。返回的 Trie 不会再改变，可以保存下来作为历史版本。
     */
    public Trie snapshot() {
        rootLock.lock();
        try {
            return root;
        } finally {
            rootLock.unlock();
        }
    }

    private void publish(Trie next) {
        rootLock.lock();
        try {
            root = next;
        } finally {
            rootLock.unlock();
        }
    }
}
