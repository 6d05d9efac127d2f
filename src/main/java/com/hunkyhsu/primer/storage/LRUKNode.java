package com.hunkyhsu.primer.storage;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 单个 Frame 的访问记录
 *
 * <p>history 只保留最近 k 次访问的时间戳，队头即第 k 次最近访问（backward k-distance）。
 * 本类不是线程安全的，由 {@link LRUKReplacer} 的锁保护。
 */
@Getter
class LRUKNode {

    private final int frameId;

    private final Deque<Long> history;

    private int accessCount;

    @Setter
    private boolean evictable;

    LRUKNode(int frameId) {
        this.frameId = frameId;
        this.history = new ArrayDeque<>();
        this.accessCount = 0;
        this.evictable = false;
    }

    /**
     * 追加一次访问，超过 k 条时丢弃最旧的时间戳
     *
     * @return 追加后的访问次数
     */
    int recordAccess(long timestamp, int k) {
        history.addLast(timestamp);
        if (history.size() > k) {
            history.removeFirst();
        }
        return ++accessCount;
    }

    /**
     * 保留的最旧时间戳。accessCount >= k 时即为 backward k-distance。
     */
    long getBackwardKDistance() {
        Long oldest = history.peekFirst();
        if (oldest == null) {
            throw new IllegalStateException("Frame " + frameId + " has no access history");
        }
        return oldest;
    }
}
