package com.hunkyhsu.bufcore.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LRU-K Replacer - 基于后向 K 距离（backward k-distance）的页面替换器
 *
 * 淘汰规则：
 * - 访问次数不足 K 次的 Frame，后向 K 距离视为无穷大，优先淘汰
 * - 距离相同（包括都是无穷大）时，最早访问时间戳更小的先淘汰
 * - 都有 K 次访问时，最新访问与第 K 新访问的时间差越大越先淘汰
 *
 * 核心设计：
 * - 每个 Frame 保存最多 K 个逻辑时间戳（旧 -> 新）
 * - 逻辑时钟每次 recordAccess 加一
 * - 所有操作共用一把 ReentrantLock
 * - evict 全量扫描所有可淘汰 Frame，O(n)
 *
 * 数据结构：
 * - LinkedHashMap 的迭代顺序 = 最近访问顺序（最近访问的在末尾），删除 O(1)；
 *   淘汰算法不依赖这个顺序
 *
 * @author hunkyhsu
 */
public class LRUKReplacer implements Replacer {

    private static final Logger logger = LoggerFactory.getLogger(LRUKReplacer.class);

    public static final int DEFAULT_K = 10;

    private static final long INF_DISTANCE = Long.MAX_VALUE;

    private final int numFrames;

    private final int k;

    private final LinkedHashMap<Integer, FrameRecord> records;

    private final ReentrantLock lock;

    private long currentTimestamp = 0;

    private int evictableSize = 0;

    public LRUKReplacer(int numFrames) {
        this(numFrames, DEFAULT_K);
    }

    public LRUKReplacer(int numFrames, int k) {
        if (numFrames < 0) {
            throw new IllegalArgumentException("numFrames must be non-negative: " + numFrames);
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1: " + k);
        }
        this.numFrames = numFrames;
        this.k = k;
        this.records = new LinkedHashMap<>(numFrames);
        this.lock = new ReentrantLock();
        logger.info("LRU-K Replacer initialized: numFrames={}, k={}", numFrames, k);
    }

    @Override
    public void recordAccess(int frameId, AccessType accessType) {
        if (frameId < 0 || frameId >= numFrames) {
            throw new IllegalArgumentException(String.format(
                    "Invalid frameId: %d (numFrames: %d)", frameId, numFrames));
        }
        lock.lock();
        try {
            long timestamp = currentTimestamp++;
            // remove + put 把记录移到末尾（最近访问）
            FrameRecord record = records.remove(frameId);
            if (record == null) {
                record = new FrameRecord();
                logger.trace("Frame {} tracked for the first time", frameId);
            }
            record.access(timestamp, k);
            records.put(frameId, record);
            logger.trace("Frame {} accessed at ts={} (type={}, history={})",
                    frameId, timestamp, accessType, record.history.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setEvictable(int frameId, boolean evictable) {
        lock.lock();
        try {
            FrameRecord record = records.get(frameId);
            if (record == null) {
                return;
            }
            if (record.evictable && !evictable) {
                evictableSize--;
            } else if (!record.evictable && evictable) {
                evictableSize++;
            }
            record.evictable = evictable;
            logger.trace("Frame {} evictable={} (evictableSize={})", frameId, evictable, evictableSize);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 选择后向 K 距离最大的可淘汰 Frame
     *
     * @return 被淘汰的 Frame ID，没有可淘汰的 Frame 时返回 empty
     */
    @Override
    public Optional<Integer> evict() {
        lock.lock();
        try {
            if (evictableSize == 0) {
                logger.debug("No victim available (no evictable frames)");
                return Optional.empty();
            }

            int victim = -1;
            FrameRecord best = null;
            for (Map.Entry<Integer, FrameRecord> entry : records.entrySet()) {
                FrameRecord candidate = entry.getValue();
                if (!candidate.evictable) {
                    continue;
                }
                if (best == null || isBetterVictim(candidate, best)) {
                    best = candidate;
                    victim = entry.getKey();
                }
            }

            records.remove(victim);
            evictableSize--;
            logger.debug("Victim selected: frameId={}, earliestTs={}, distance={}",
                    victim, best.earliestTimestamp(), formatDistance(best.distance(k)));
            return Optional.of(victim);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(int frameId) {
        lock.lock();
        try {
            FrameRecord record = records.get(frameId);
            if (record == null) {
                throw new IllegalArgumentException("Frame id " + frameId + " doesn't exist in replacer");
            }
            if (!record.evictable) {
                throw new IllegalStateException("Frame id " + frameId + " is not evictable");
            }
            records.remove(frameId);
            evictableSize--;
            logger.debug("Frame {} removed (evictableSize={})", frameId, evictableSize);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return evictableSize;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前被跟踪（有访问记录）的 Frame 数量，包括不可淘汰的
     */
    public int trackedSize() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int getK() {
        return k;
    }

    public int getNumFrames() {
        return numFrames;
    }

    private boolean isBetterVictim(FrameRecord candidate, FrameRecord best) {
        long candidateDistance = candidate.distance(k);
        long bestDistance = best.distance(k);
        if (candidateDistance != bestDistance) {
            return candidateDistance > bestDistance;
        }
        return candidate.earliestTimestamp() < best.earliestTimestamp();
    }

    private static String formatDistance(long distance) {
        return distance == INF_DISTANCE ? "+inf" : Long.toString(distance);
    }

    /**
     * 单个 Frame 的访问记录
     */
    private static final class FrameRecord {

        // 旧 -> 新，最多 k 个
        private final Deque<Long> history = new ArrayDeque<>();

        private boolean evictable = false;

        void access(long timestamp, int k) {
            if (history.size() >= k) {
                history.pollFirst();
            }
            history.addLast(timestamp);
        }

        long earliestTimestamp() {
            return history.peekFirst();
        }

        long distance(int k) {
            if (history.size() < k) {
                return INF_DISTANCE;
            }
            return history.peekLast() - history.peekFirst();
        }
    }
}
