package com.hunkyhsu.primer.storage;

/**
 * Replacer - 页面替换策略接口
 *
 * 职责：
 * - 记录每个 Frame 的访问历史
 * - 决定当 BufferPool 满时应该淘汰哪个 Frame
 * - 管理 Frame 的可淘汰状态（pinCount == 0 时可淘汰）
 * - 提供线程安全的操作接口
 *
 * 实现策略：LRU-K
 *
 * @author hunkyhsu
 * @see LRUKReplacer
 */
public interface Replacer {

    /**
     * 没有可淘汰 Frame 时 {@link #evict()} 的返回值
     */
    int INVALID_FRAME_ID = -1;

    /**
     * 记录一次对 Frame 的访问
     *
     * 每次 fetch / new page 时由 BufferPool 调用
     *
     * @param frameId Frame ID
     * @param accessType 访问类型
     * @throws IllegalArgumentException frameId 越界
     */
    void recordAccess(int frameId, AccessType accessType);

    default void recordAccess(int frameId) {
        recordAccess(frameId, AccessType.UNKNOWN);
    }

    /**
     * 选择一个 Frame 进行淘汰（Evict），并清空它的访问历史
     *
     * @return Frame ID，如果没有可淘汰的 Frame 则返回 {@link #INVALID_FRAME_ID}
     */
    int evict();

    /**
     * 设置 Frame 是否可淘汰
     *
     * pinCount 从 0 变为 1 时传 false，从 1 变为 0 时传 true。
     * 从未被访问过的 Frame 忽略。
     *
     * @param frameId Frame ID
     * @param evictable 是否可淘汰
     */
    void setEvictable(int frameId, boolean evictable);

    /**
     * 强制移除一个 Frame 的访问历史（不经过淘汰策略）
     *
     * @param frameId Frame ID
     * @throws IllegalArgumentException frameId 越界
     * @throws IllegalStateException Frame 仍被 pin 住（不可淘汰）
     */
    void remove(int frameId);

    /**
     * 获取当前可淘汰的 Frame 数量
     *
     * @return 可淘汰的 Frame 数量
     */
    int size();

}
