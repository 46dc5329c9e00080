package com.hunkyhsu.bufcore.storage;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FileDiskManager 单元测试
 *
 * 测试覆盖：
 * 1. Page 分配
 * 2. 基本读写和持久化
 * 3. 异常处理
 * 4. 并发写入
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class FileDiskManagerTest {

    private static final Logger logger = LoggerFactory.getLogger(FileDiskManagerTest.class);

    @TempDir
    Path tempDir;

    private String dbPath;

    private FileDiskManager diskManager;

    @BeforeEach
    void setUp() throws IOException {
        dbPath = tempDir.resolve("data/test_disk_manager.db").toString();
        diskManager = new FileDiskManager(dbPath);
    }

    @AfterEach
    void tearDown() {
        if (diskManager != null) {
            diskManager.close();
        }
    }

    private static ByteBuffer pageWith(String content) {
        ByteBuffer buffer = ByteBuffer.allocate(DiskManager.PAGE_SIZE);
        buffer.put(content.getBytes(StandardCharsets.UTF_8));
        return buffer;
    }

    private static String readString(ByteBuffer buffer, int length) {
        byte[] data = new byte[length];
        buffer.get(data);
        return new String(data, StandardCharsets.UTF_8);
    }

    // ========== 基本功能测试 ==========

    @Test
    @Order(1)
    @DisplayName("测试：分配新 Page")
    void testAllocatePage() throws IOException {
        assertEquals(0, diskManager.allocatePage(), "First page ID should be 0");
        assertEquals(1, diskManager.allocatePage(), "Second page ID should be 1");

        assertEquals(2L * DiskManager.PAGE_SIZE, Files.size(Path.of(dbPath)),
                "File size should be 2 * PAGE_SIZE");
        assertEquals(2, diskManager.getNumPages());

        // 新分配的 Page 全是 0
        ByteBuffer buffer = ByteBuffer.allocate(DiskManager.PAGE_SIZE);
        diskManager.readPage(1, buffer);
        while (buffer.hasRemaining()) {
            assertEquals(0, buffer.get());
        }

        logger.info("✅ testAllocatePage passed");
    }

    @Test
    @Order(2)
    @DisplayName("测试：写入和读取 Page")
    void testWriteAndReadPage() throws IOException {
        int pageId = diskManager.allocatePage();
        String testData = "Hello MiniDB Test";

        ByteBuffer writeBuffer = pageWith(testData);
        int positionBeforeWrite = writeBuffer.position();
        diskManager.writePage(pageId, writeBuffer);
        assertEquals(positionBeforeWrite, writeBuffer.position(), "writePage should not move the caller's buffer");

        ByteBuffer readBuffer = ByteBuffer.allocate(DiskManager.PAGE_SIZE);
        diskManager.readPage(pageId, readBuffer);
        assertEquals(0, readBuffer.position());
        assertEquals(DiskManager.PAGE_SIZE, readBuffer.limit());
        assertEquals(testData, readString(readBuffer, testData.length()));

        assertEquals(1, diskManager.getNumWrites());
        assertEquals(1, diskManager.getNumReads());

        logger.info("✅ testWriteAndReadPage passed");
    }

    @Test
    @Order(3)
    @DisplayName("测试：数据持久化（重启验证）")
    void testPersistence() throws IOException {
        int pageId = diskManager.allocatePage();
        String persistentData = "This data must survive restart";
        diskManager.writePage(pageId, pageWith(persistentData));
        diskManager.close();

        diskManager = new FileDiskManager(dbPath);
        assertEquals(1, diskManager.getNumPages(), "Should have 1 page after restart");

        ByteBuffer readBuffer = ByteBuffer.allocate(DiskManager.PAGE_SIZE);
        diskManager.readPage(pageId, readBuffer);
        assertEquals(persistentData, readString(readBuffer, persistentData.length()),
                "Data should persist after restart");

        logger.info("✅ testPersistence passed");
    }

    @Test
    @Order(7)
    @DisplayName("测试：文件末尾不完整的页被忽略，重新分配后全是 0")
    void testPartialTrailingPage() throws IOException {
        Path partial = tempDir.resolve("partial.db");
        byte[] garbage = new byte[DiskManager.PAGE_SIZE + 100];
        Arrays.fill(garbage, (byte) 0x5A);
        Files.write(partial, garbage);

        try (FileDiskManager reopened = new FileDiskManager(partial.toString())) {
            assertEquals(1, reopened.getNumPages(), "the partial page must not be counted");

            int pageId = reopened.allocatePage();
            assertEquals(1, pageId);
            ByteBuffer buffer = ByteBuffer.allocate(DiskManager.PAGE_SIZE);
            reopened.readPage(pageId, buffer);
            while (buffer.hasRemaining()) {
                assertEquals(0, buffer.get());
            }
        }
        assertEquals(2L * DiskManager.PAGE_SIZE, Files.size(partial));

        logger.info("✅ testPartialTrailingPage passed");
    }

    // ========== 异常处理测试 ==========

    @Test
    @Order(4)
    @DisplayName("测试：读写无效的 Page ID")
    void testInvalidPageId() {
        ByteBuffer buffer = ByteBuffer.allocate(DiskManager.PAGE_SIZE);
        assertThrows(IllegalArgumentException.class, () -> diskManager.readPage(-1, buffer));
        assertThrows(IllegalArgumentException.class, () -> diskManager.readPage(999, buffer));
        assertThrows(IllegalArgumentException.class, () -> diskManager.writePage(-1, buffer));
        assertThrows(IllegalArgumentException.class, () -> diskManager.writePage(999, buffer));

        logger.info("✅ testInvalidPageId passed");
    }

    @Test
    @Order(5)
    @DisplayName("测试：Buffer 大小不是一页")
    void testWrongBufferSize() throws IOException {
        int pageId = diskManager.allocatePage();
        ByteBuffer small = ByteBuffer.allocate(DiskManager.PAGE_SIZE / 2);

        assertThrows(IllegalArgumentException.class, () -> diskManager.readPage(pageId, small));
        assertThrows(IllegalArgumentException.class, () -> diskManager.writePage(pageId, small));
        assertEquals(0, diskManager.getNumWrites());

        logger.info("✅ testWrongBufferSize passed");
    }

    // ========== 并发测试 ==========

    @Test
    @Order(6)
    @DisplayName("测试：并发写入不同 Page")
    void testConcurrentWriteDifferentPages() throws Exception {
        int numThreads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        ConcurrentHashMap<Integer, String> expectedData = new ConcurrentHashMap<>();
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    int pageId = diskManager.allocatePage();
                    String data = "Thread " + threadId + " data";
                    expectedData.put(pageId, data);
                    diskManager.writePage(pageId, pageWith(data));
                } catch (Exception e) {
                    logger.error("Concurrent write error in thread " + threadId, e);
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS), "Test should complete within 30 seconds");
        executor.shutdown();

        assertEquals(0, errorCount.get(), "No errors should occur");
        assertEquals(numThreads, diskManager.getNumPages());

        for (var entry : expectedData.entrySet()) {
            ByteBuffer buffer = ByteBuffer.allocate(DiskManager.PAGE_SIZE);
            diskManager.readPage(entry.getKey(), buffer);
            assertEquals(entry.getValue(), readString(buffer, entry.getValue().length()),
                    "Page " + entry.getKey() + " data should match");
        }

        logger.info("✅ testConcurrentWriteDifferentPages passed ({} threads)", numThreads);
    }
}
