package com.hunkyhsu.bufcore.storage;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Disk IO Manager
 *
 * 同步、按页读写。调用会阻塞直到完成，出错时抛出 IOException。
 * 在 bufcore 中只有 {@link DiskScheduler} 的后台线程会调用它。
 */
public interface DiskManager extends Closeable {

    int PAGE_SIZE = 4096; // 4kb

    /**
     * 把一页内容读入 data（从 position 0 开始填满整页），读完后 data 已 flip
     */
    void readPage(int pageId, ByteBuffer data) throws IOException;

    /**
     * 把 data 中的一整页写到磁盘
     */
    void writePage(int pageId, ByteBuffer data) throws IOException;

    @Override
    void close();

    static void checkPageBuffer(ByteBuffer data) {
        if (data == null) {
            throw new NullPointerException("page buffer must not be null");
        }
        if (data.capacity() != PAGE_SIZE) {
            throw new IllegalArgumentException(String.format(
                    "Page buffer capacity must be %d bytes, got %d", PAGE_SIZE, data.capacity()));
        }
    }
}
