package com.mudhub.realtime.janitor;

/**
 * 清理触发原因。
 */
public enum CleanupTrigger {
    /** 到达常规清理间隔 */
    TIME,
    /** 内存使用率超过阈值 */
    MEMORY,
    /** 运维手动触发 */
    FORCED
}
