package com.mudhub.realtime.janitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次清理的结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupReport {

    private CleanupTrigger trigger;

    /** 开始时间（毫秒时间戳） */
    private long startedAt;

    private long durationMillis;

    /** 清理前的堆内存使用率 */
    private double memoryUsage;

    private int staleConnections;

    private int unhealthyConnections;

    private int expiredPendingMessages;

    private int expiredRateBuckets;

    private int trimmedPendingMessages;

    private int trimmedRateEntries;

    private int prunedIdentities;

    private int releasedSubscriptions;

    public int getClosedConnections() {
        return staleConnections + unhealthyConnections;
    }
}
