package com.mudhub.realtime.ratelimit;

/**
 * 限流器统计：桶数量与记录总数。
 */
public record RateLimiterStats(int buckets, long trackedAttempts) {
}
