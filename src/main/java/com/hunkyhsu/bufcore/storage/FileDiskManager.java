package com.hunkyhsu.bufcore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 基于单个文件的 DiskManager，第 n 页位于 offset = n * PAGE_SIZE
 */
public class FileDiskManager implements DiskManager {
    private static final Logger logger = LoggerFactory.getLogger(FileDiskManager.class);

    private final FileChannel fileChannel;
    private final Path dbFilePath;
    private final AtomicInteger numPages;
    private final AtomicInteger numReads = new AtomicInteger(0);
    private final AtomicInteger numWrites = new AtomicInteger(0);

    public FileDiskManager(String dbFilePath) throws IOException {
        this.dbFilePath = Path.of(dbFilePath).toAbsolutePath();
        Files.createDirectories(this.dbFilePath.getParent());
        this.fileChannel = FileChannel.open(this.dbFilePath,
                StandardOpenOption.READ, StandardOpenOption.WRITE, StandardOpenOption.CREATE);

        // 末尾不完整的页不计入，下一次 allocatePage 用 0 覆盖它
        long fileSize = fileChannel.size();
        if (fileSize % PAGE_SIZE != 0) {
            logger.warn("Ignoring {} trailing bytes of a partial page in {}", fileSize % PAGE_SIZE, this.dbFilePath);
        }
        this.numPages = new AtomicInteger((int) (fileSize / PAGE_SIZE));
        logger.info("Disk Manager opened: file={}, pages={}", this.dbFilePath, numPages.get());
    }

    @Override
    public void readPage(int pageId, ByteBuffer data) throws IOException {
        checkPageId(pageId);
        DiskManager.checkPageBuffer(data);
        long offset = (long) pageId * PAGE_SIZE;

        data.clear();
        int totalBytesRead = 0;
        while (totalBytesRead < PAGE_SIZE) {
            int bytesRead = this.fileChannel.read(data, offset + totalBytesRead);
            if (bytesRead == -1) {
                throw new IOException(String.format(
                        "Unexpected EOF: page %d is incomplete (expected %d bytes, got %d)",
                        pageId, PAGE_SIZE, totalBytesRead));
            }
            totalBytesRead += bytesRead;
        }
        // position 归零，limit = 已读取的字节数
        data.flip();
        numReads.incrementAndGet();
        if (logger.isDebugEnabled()) {
            logger.debug("Read page {} from disk (offset={}, bytes={})", pageId, offset, totalBytesRead);
        }
    }

    @Override
    public void writePage(int pageId, ByteBuffer data) throws IOException {
        checkPageId(pageId);
        DiskManager.checkPageBuffer(data);
        long offset = (long) pageId * PAGE_SIZE;
        try {
            // 独立视图写整页，不改动调用方 buffer 的 position
            ByteBuffer view = data.duplicate();
            view.clear();
            int totalBytesWritten = 0;
            while (view.hasRemaining()) {
                totalBytesWritten += fileChannel.write(view, offset + totalBytesWritten);
            }
            fileChannel.force(false);
            numWrites.incrementAndGet();
            if (logger.isDebugEnabled()) {
                logger.debug("Wrote page {} to disk (offset={}, bytes={})", pageId, offset, totalBytesWritten);
            }
        } catch (IOException e) {
            throw new IOException(String.format(
                    "Failed to write page %d (offset=%d): %s", pageId, offset, e.getMessage()), e);
        }
    }

    /**
     * 在文件末尾追加一个全 0 的新页
     */
    public int allocatePage() throws IOException {
        int newPageId = numPages.getAndIncrement();
        long offset = (long) newPageId * PAGE_SIZE;
        ByteBuffer zeros = ByteBuffer.allocate(PAGE_SIZE);
        try {
            while (zeros.hasRemaining()) {
                if (fileChannel.write(zeros, offset + zeros.position()) == 0) {
                    throw new IOException("Cannot extend file, possibly full");
                }
            }
        } catch (IOException e) {
            numPages.decrementAndGet();
            throw new IOException("Failed to allocate page " + newPageId, e);
        }
        logger.debug("Allocated new page {}", newPageId);
        return newPageId;
    }

    private void checkPageId(int pageId) {
        if (pageId < 0 || pageId >= numPages.get()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid pageId: %d (total pages: %d)", pageId, numPages.get()));
        }
    }

    public int getNumPages() {
        return numPages.get();
    }

    public int getNumReads() {
        return numReads.get();
    }

    public int getNumWrites() {
        return numWrites.get();
    }

    @Override
    public void close() {
        if (!fileChannel.isOpen()) {
            return;
        }
        try (FileChannel channel = fileChannel) {
            channel.force(true);
        } catch (IOException e) {
            logger.error("Failed to sync {} on close", dbFilePath, e);
            return;
        }
        logger.info("Disk Manager closed: file={}", dbFilePath);
    }

}
