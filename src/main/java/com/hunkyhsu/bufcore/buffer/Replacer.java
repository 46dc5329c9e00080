package com.hunkyhsu.bufcore.buffer;

import java.util.Optional;

/**
 * Replacer - 页面替换策略接口
 *
 * 职责：
 * - 记录每个 Frame 的访问历史
 * - 维护 Frame 是否可被淘汰（evictable）
 * - 当 BufferPool 满时决定应该淘汰哪个 Frame
 * - 所有操作线程安全，但多次调用之间不保证原子性
 *
 * 实现策略：LRU-K
 *
 * @author hunkyhsu
 */
public interface Replacer {

    /**
     * 记录一次对 Frame 的访问
     *
     * 如果 Frame 之前没有被记录过，会新建记录，默认不可淘汰
     *
     * @param frameId Frame ID，必须在 [0, numFrames) 范围内
     * @throws IllegalArgumentException frameId 越界
     */
    default void recordAccess(int frameId) {
        recordAccess(frameId, AccessType.UNKNOWN);
    }

    /**
     * 记录一次带访问类型的访问
     *
     * @param frameId    Frame ID
     * @param accessType 访问类型
     * @throws IllegalArgumentException frameId 越界
     */
    void recordAccess(int frameId, AccessType accessType);

    /**
     * 设置 Frame 是否可以被淘汰
     *
     * 当 Page 的 pinCount 降为 0 时设为 true，被 pin 住时设为 false。
     * Frame 未被记录时什么也不做。
     *
     * @param frameId   Frame ID
     * @param evictable 是否可淘汰
     */
    void setEvictable(int frameId, boolean evictable);

    /**
     * 选择一个 Frame 进行淘汰（Evict），并删除它的访问记录
     *
     * @return 被淘汰的 Frame ID；没有可淘汰的 Frame 时返回 {@link Optional#empty()}
     */
    Optional<Integer> evict();

    /**
     * 删除指定 Frame 的访问记录（不走淘汰算法）
     *
     * 只允许删除已记录且可淘汰的 Frame
     *
     * @param frameId Frame ID
     * @throws IllegalArgumentException Frame 未被记录
     * @throws IllegalStateException    Frame 不可淘汰
     */
    void remove(int frameId);

    /**
     * 获取当前可淘汰的 Frame 数量
     *
     * @return 可淘汰的 Frame 数量
     */
    int size();

}
