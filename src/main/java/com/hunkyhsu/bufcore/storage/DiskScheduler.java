package com.hunkyhsu.bufcore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Disk Scheduler - 把同步的磁盘 IO 变成异步、有序的服务
 *
 * 核心设计：
 * - 任意线程调用 schedule() 入队，立即返回（无界队列，不阻塞）
 * - 唯一的后台线程按 FIFO 顺序取出请求，调用 DiskManager 同步读写，
 *   然后 complete(true) 请求的 callback
 * - close() 入队一个哨兵（Optional.empty()）并 join 后台线程，
 *   哨兵之前的请求全部处理完后线程才退出
 *
 * 错误处理：
 * - DiskManager 抛出的异常不重试、不通过 callback 报告，后台线程直接终止；
 *   出错请求以及之后入队的请求的 callback 都不会完成，之后的 schedule() 直接报错
 * - 调用方自己提前完成（cancel、超时）的 callback 不影响后台线程
 *
 * @author hunkyhsu
 */
public class DiskScheduler implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(DiskScheduler.class);

    static final String WORKER_THREAD_NAME = "disk-scheduler-worker";

    private final DiskManager diskManager;

    // Optional.empty() 是退出哨兵
    private final LinkedBlockingQueue<Optional<DiskRequest>> requestQueue;

    private final Thread backgroundThread;

    // 保证 closed 检查与入队的原子性，哨兵之后不会再有请求入队
    private final ReentrantLock queueLock;

    private boolean closed = false;

    public DiskScheduler(DiskManager diskManager) {
        this.diskManager = Objects.requireNonNull(diskManager, "diskManager must not be null");
        this.requestQueue = new LinkedBlockingQueue<>();
        this.queueLock = new ReentrantLock();
        this.backgroundThread = new Thread(this::startWorkerThread, WORKER_THREAD_NAME);
        this.backgroundThread.setUncaughtExceptionHandler((thread, e) ->
                logger.error("Disk scheduler worker terminated by fault, {} request(s) left unserved",
                        requestQueue.size(), e));
        this.backgroundThread.start();
        logger.info("DiskScheduler started (worker={})", WORKER_THREAD_NAME);
    }

    /**
     * 创建一个新的 callback，交给 DiskRequest 使用
     */
    public CompletableFuture<Boolean> createPromise() {
        return new CompletableFuture<>();
    }

    /**
     * 入队一个磁盘请求，立即返回
     *
     * @throws IllegalStateException scheduler 已经关闭，或后台线程已经因故障退出
     */
    public void schedule(DiskRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        queueLock.lock();
        try {
            checkOpen();
            requestQueue.offer(Optional.of(request));
        } finally {
            queueLock.unlock();
        }
        logger.trace("Scheduled {}", request);
    }

    /**
     * 按列表顺序连续入队一批请求，其他线程的请求不会插在中间
     *
     * @throws IllegalStateException scheduler 已经关闭，或后台线程已经因故障退出
     */
    public void schedule(List<DiskRequest> requests) {
        for (DiskRequest request : requests) {
            Objects.requireNonNull(request, "request must not be null");
        }
        queueLock.lock();
        try {
            checkOpen();
            for (DiskRequest request : requests) {
                requestQueue.offer(Optional.of(request));
            }
        } finally {
            queueLock.unlock();
        }
        logger.trace("Scheduled batch of {} requests", requests.size());
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("DiskScheduler is closed");
        }
        if (!backgroundThread.isAlive()) {
            throw new IllegalStateException("DiskScheduler worker has terminated, request would never be served");
        }
    }

    private void startWorkerThread() {
        for (;;) {
            Optional<DiskRequest> maybeRequest;
            try {
                maybeRequest = requestQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Disk scheduler worker interrupted, exiting with {} request(s) queued",
                        requestQueue.size());
                return;
            }
            if (maybeRequest.isEmpty()) {
                logger.debug("Disk scheduler worker received shutdown sentinel");
                return;
            }
            process(maybeRequest.get());
        }
    }

    private void process(DiskRequest request) {
        try {
            if (request.isWrite()) {
                diskManager.writePage(request.getPageId(), request.getData());
            } else {
                diskManager.readPage(request.getPageId(), request.getData());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Disk I/O failed for " + request, e);
        }
        if (!request.getCallback().complete(true)) {
            // 调用方已经 cancel / 超时完成了 callback，结果没人要了，继续处理后面的请求
            logger.warn("Served {} but its callback was already completed by the caller", request);
            return;
        }
        logger.debug("Served {}", request);
    }

    public boolean isRunning() {
        return backgroundThread.isAlive();
    }

    public int pendingRequests() {
        return requestQueue.size();
    }

    /**
     * 入队哨兵并等待后台线程退出。可以重复调用，哨兵只入队一次。
     */
    @Override
    public void close() {
        queueLock.lock();
        try {
            if (!closed) {
                closed = true;
                int pending = requestQueue.size();
                requestQueue.offer(Optional.empty());
                logger.info("Closing DiskScheduler ({} request(s) to drain)", pending);
            }
        } finally {
            queueLock.unlock();
        }

        if (Thread.currentThread() == backgroundThread) {
            // 在 callback 的回调里关闭，不能 join 自己
            logger.warn("DiskScheduler closed from its own worker thread, skipping join");
            return;
        }
        try {
            backgroundThread.join();
            logger.info("DiskScheduler closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for disk scheduler worker to exit");
        }
    }
}
