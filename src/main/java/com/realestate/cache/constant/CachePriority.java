package com.realestate.cache.constant;

/**
 * 写入优先级，HIGH 会强制写入持久层
 */
public enum CachePriority {
    LOW,
    NORMAL,
    HIGH
}
