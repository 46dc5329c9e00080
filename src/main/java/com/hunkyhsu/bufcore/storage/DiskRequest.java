package com.hunkyhsu.bufcore.storage;

import lombok.Getter;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 一次磁盘读/写请求
 *
 * data 由调用方持有，在 callback 完成之前调用方不能再读写它；
 * callback 由后台线程 complete(true) 恰好一次。
 */
@Getter
public final class DiskRequest {

    private final boolean write;

    private final int pageId;

    private final ByteBuffer data;

    private final CompletableFuture<Boolean> callback;

    private DiskRequest(boolean write, int pageId, ByteBuffer data, CompletableFuture<Boolean> callback) {
        if (pageId < 0) {
            throw new IllegalArgumentException("Invalid pageId: " + pageId);
        }
        DiskManager.checkPageBuffer(data);
        this.write = write;
        this.pageId = pageId;
        this.data = data;
        this.callback = Objects.requireNonNull(callback, "callback must not be null");
    }

    public static DiskRequest read(int pageId, ByteBuffer data, CompletableFuture<Boolean> callback) {
        return new DiskRequest(false, pageId, data, callback);
    }

    public static DiskRequest write(int pageId, ByteBuffer data, CompletableFuture<Boolean> callback) {
        return new DiskRequest(true, pageId, data, callback);
    }

    @Override
    public String toString() {
        return (write ? "WRITE" : "READ") + "(page=" + pageId + ")";
    }
}
