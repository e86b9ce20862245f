package com.mudhub.realtime.janitor;

/**
 * 清理任务累计统计。
 */
public record JanitorStats(long cleanupsPerformed,
                           long timeBasedCleanups,
                           long memoryBasedCleanups,
                           long forcedCleanups,
                           long lastCleanupAt,
                           double memoryUsage,
                           CleanupReport lastReport) {
}
