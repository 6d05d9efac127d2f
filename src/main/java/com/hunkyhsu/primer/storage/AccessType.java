package com.hunkyhsu.primer.storage;

/**
 * 页面访问类型。目前只用于日志，不影响淘汰顺序。
 */
public enum AccessType {
    UNKNOWN,
    LOOKUP,
    SCAN,
    INDEX
}
