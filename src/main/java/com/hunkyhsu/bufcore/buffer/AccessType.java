package com.hunkyhsu.bufcore.buffer;

/**
 * Frame 的访问类型，由 BufferPool 在 recordAccess 时传入。
 * 目前只用于日志，不参与淘汰决策。
 */
public enum AccessType {
    UNKNOWN,
    LOOKUP,
    SCAN,
    INDEX
}
