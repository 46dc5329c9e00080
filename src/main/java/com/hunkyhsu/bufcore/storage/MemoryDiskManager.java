package com.hunkyhsu.bufcore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 纯内存的 DiskManager，页数不设上限，主要用于测试
 *
 * 没有写过的页读出来全是 0
 */
public class MemoryDiskManager implements DiskManager {
    private static final Logger logger = LoggerFactory.getLogger(MemoryDiskManager.class);

    private final ConcurrentHashMap<Integer, byte[]> pages = new ConcurrentHashMap<>();
    private final AtomicInteger numReads = new AtomicInteger(0);
    private final AtomicInteger numWrites = new AtomicInteger(0);

    @Override
    public void readPage(int pageId, ByteBuffer data) {
        checkPageId(pageId);
        DiskManager.checkPageBuffer(data);

        data.clear();
        byte[] content = pages.get(pageId);
        if (content == null) {
            data.put(new byte[PAGE_SIZE]);
        } else {
            data.put(content);
        }
        data.flip();
        numReads.incrementAndGet();
        logger.debug("Read page {} from memory (present={})", pageId, content != null);
    }

    @Override
    public void writePage(int pageId, ByteBuffer data) {
        checkPageId(pageId);
        DiskManager.checkPageBuffer(data);

        byte[] content = new byte[PAGE_SIZE];
        ByteBuffer view = data.duplicate();
        view.clear();
        view.get(content);
        pages.put(pageId, content);
        numWrites.incrementAndGet();
        logger.debug("Wrote page {} to memory", pageId);
    }

    private static void checkPageId(int pageId) {
        if (pageId < 0) {
            throw new IllegalArgumentException("Invalid pageId: " + pageId);
        }
    }

    public boolean hasPage(int pageId) {
        return pages.containsKey(pageId);
    }

    public int getNumReads() {
        return numReads.get();
    }

    public int getNumWrites() {
        return numWrites.get();
    }

    @Override
    public void close() {
        logger.info("Memory Disk Manager closed ({} pages held)", pages.size());
        pages.clear();
    }
}
