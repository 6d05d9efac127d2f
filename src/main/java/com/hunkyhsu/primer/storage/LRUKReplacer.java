package com.hunkyhsu.primer.storage;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LRU-K Replacer - 基于 LRU-K 算法的页面替换器
 *
 * 核心设计：
 * - 访问次数 < k 的 Frame 放在 recentFrames（LinkedHashSet，按首次访问顺序），
 *   优先淘汰其中最早进入的
 * - 访问次数 >= k 的 Frame 放在 agedFrames（TreeMap，key = backward k-distance），
 *   淘汰第 k 次最近访问最久远的
 * - 线程安全：所有操作加同一把锁
 *
 * 数据结构：
 * - nodeStore: frameId -> LRUKNode，首次访问时创建，淘汰/移除时删除
 * - 每次 recordAccess 分配一个唯一的逻辑时间戳，因此 agedFrames 的 key 不会冲突
 *
 * @author hunkyhsu
 */
public class LRUKReplacer implements Replacer {

    private static final Logger logger = LoggerFactory.getLogger(LRUKReplacer.class);

    @Getter
    private final int replacerSize;

    @Getter
    private final int k;

    private final Map<Integer, LRUKNode> nodeStore;

    private final LinkedHashSet<Integer> recentFrames;

    private final TreeMap<Long, Integer> agedFrames;

    private final ReentrantLock lock;

    private long currentTimestamp;

    private int currSize;

    public LRUKReplacer(int replacerSize, int k) {
        if (replacerSize <= 0) {
            throw new IllegalArgumentException("replacerSize must be positive: " + replacerSize);
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        this.replacerSize = replacerSize;
        this.k = k;
        this.nodeStore = new HashMap<>(replacerSize);
        this.recentFrames = new LinkedHashSet<>();
        this.agedFrames = new TreeMap<>();
        this.lock = new ReentrantLock();
        this.currentTimestamp = 0;
        this.currSize = 0;
        logger.info("LRU-K Replacer initialized with replacerSize {}, k {}", replacerSize, k);
    }

    @Override
    public void recordAccess(int frameId, AccessType accessType) {
        lock.lock();
        try {
            checkFrameId(frameId);
            LRUKNode node = nodeStore.computeIfAbsent(frameId, LRUKNode::new);
            // 已在 agedFrames 中，先按旧的 k-distance 取出
            if (node.getAccessCount() >= k) {
                agedFrames.remove(node.getBackwardKDistance());
            }
            int count = node.recordAccess(++currentTimestamp, k);

            if (count == 1) {
                if (currSize == replacerSize) {
                    int victim = evictInternal();
                    logger.debug("Replacer full, evicted frame {} to admit frame {}", victim, frameId);
                }
                node.setEvictable(true);
                currSize++;
                recentFrames.add(frameId);
            }
            if (count == k) {
                recentFrames.remove(frameId);
            }
            if (count >= k) {
                agedFrames.put(node.getBackwardKDistance(), frameId);
            }

            logger.trace("Frame {} accessed (type={}, ts={}, count={})",
                    frameId, accessType, currentTimestamp, count);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 选择一个 Frame 进行淘汰
     *
     * 实现：先扫描 recentFrames（最早进入的在前），再按 k-distance 升序扫描 agedFrames，
     * 返回第一个可淘汰的 Frame
     *
     * @return Frame ID，如果没有可淘汰的 Frame 则返回 -1
     */
    @Override
    public int evict() {
        lock.lock();
        try {
            int frameId = evictInternal();
            if (frameId == INVALID_FRAME_ID) {
                logger.debug("No victim available (all frames are pinned)");
            } else {
                logger.debug("Victim selected: frameId={}", frameId);
            }
            return frameId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setEvictable(int frameId, boolean evictable) {
        lock.lock();
        try {
            LRUKNode node = nodeStore.get(frameId);
            if (node == null || node.getAccessCount() == 0) {
                return;
            }
            if (node.isEvictable() == evictable) {
                return;
            }
            // 可淘汰集合已满，先腾出一个位置（当前 Frame 仍是 pinned，不会被选中）
            if (evictable && currSize == replacerSize) {
                int victim = evictInternal();
                logger.debug("Replacer full, evicted frame {} to unpin frame {}", victim, frameId);
            }
            node.setEvictable(evictable);
            currSize += evictable ? 1 : -1;
            logger.trace("Frame {} set evictable={} (size={})", frameId, evictable, currSize);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(int frameId) {
        lock.lock();
        try {
            checkFrameId(frameId);
            LRUKNode node = nodeStore.get(frameId);
            if (node == null || node.getAccessCount() == 0) {
                return;
            }
            if (!node.isEvictable()) {
                logger.warn("Cannot remove frame {}: frame is pinned", frameId);
                throw new IllegalStateException("Cannot remove non-evictable frame " + frameId);
            }
            detach(node);
            logger.debug("Frame {} removed from replacer", frameId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return currSize;
        } finally {
            lock.unlock();
        }
    }

    public String getStats() {
        lock.lock();
        try {
            return String.format(
                    "Replacer Stats: replacerSize=%d, k=%d, tracked=%d, evictable=%d, recent=%d, aged=%d",
                    replacerSize, k, nodeStore.size(), currSize, recentFrames.size(), agedFrames.size()
            );
        } finally {
            lock.unlock();
        }
    }

    // 调用方必须已持有 lock
    private int evictInternal() {
        if (currSize == 0) {
            return INVALID_FRAME_ID;
        }
        for (int frameId : recentFrames) {
            if (nodeStore.get(frameId).isEvictable()) {
                detach(nodeStore.get(frameId));
                return frameId;
            }
        }
        for (int frameId : agedFrames.values()) {
            if (nodeStore.get(frameId).isEvictable()) {
                detach(nodeStore.get(frameId));
                return frameId;
            }
        }
        return INVALID_FRAME_ID;
    }

    // 从所在队列中摘除并清空访问历史
    private void detach(LRUKNode node) {
        int frameId = node.getFrameId();
        if (node.getAccessCount() < k) {
            recentFrames.remove(frameId);
        } else {
            agedFrames.remove(node.getBackwardKDistance());
        }
        nodeStore.remove(frameId);
        currSize--;
    }

    private void checkFrameId(int frameId) {
        // 与 BufferPool 的约定：合法范围是 [0, replacerSize]
        if (frameId < 0 || frameId > replacerSize) {
            logger.warn("Invalid frame id {} (replacerSize={})", frameId, replacerSize);
            throw new IllegalArgumentException("Invalid frame id: " + frameId);
        }
    }
}
