package com.mudhub.realtime.ratelimit;

import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.realtime.routing.ChannelKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 滑动窗口限流（按 玩家 + 频道 计数）。
 *
 * 每个桶保存窗口内的放行时间戳；所有读写都在 {@link ConcurrentMap#compute} 内完成，
 * 同一个桶上的判定是原子的，不同桶互不影响。
 */
@Slf4j
public class RateLimiter {

    private final ConcurrentMap<BucketKey, Deque<Long>> buckets = new ConcurrentHashMap<>();
    private final Map<ChannelKind, Integer> limits;
    private final long windowMillis;
    private final Clock clock;

    public RateLimiter(RealtimeProperties.RateLimit config, Clock clock) {
        this(config.getWindow(), config.getLimits(), clock);
    }

    public RateLimiter(Duration window, Map<ChannelKind, Integer> limits, Clock clock) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("rate limit window must be positive");
        }
        this.windowMillis = window.toMillis();
        this.limits = new EnumMap<>(ChannelKind.class);
        this.limits.putAll(limits);
        this.clock = clock;
    }

    /**
     * 尝试放行一次发送。
     *
     * @return true 放行并计数；false 窗口内已达上限（不计数）
     */
    public boolean admit(String identity, ChannelKind kind) {
        int limit = limitFor(kind);
        if (limit <= 0) {
            return true;
        }
        long now = clock.millis();
        boolean[] admitted = new boolean[1];
        buckets.compute(new BucketKey(identity, kind), (key, window) -> {
            Deque<Long> history = window == null ? new ArrayDeque<>() : window;
            evictBefore(history, now - windowMillis);
            if (history.size() < limit) {
                history.addLast(now);
                admitted[0] = true;
            }
            return history;
        });
        if (!admitted[0]) {
            log.debug("发送被限流: identity={}, channel={}, limit={}/{}s", identity, kind, limit, windowMillis / 1000);
        }
        return admitted[0];
    }

    public RateLimitInfo info(String identity, ChannelKind kind) {
        int limit = limitFor(kind);
        long now = clock.millis();
        long[] snapshot = new long[2];
        buckets.computeIfPresent(new BucketKey(identity, kind), (key, window) -> {
            evictBefore(window, now - windowMillis);
            snapshot[0] = window.size();
            snapshot[1] = window.isEmpty() ? 0 : window.peekFirst() + windowMillis;
            return window.isEmpty() ? null : window;
        });
        int attempts = (int) snapshot[0];
        int remaining = limit <= 0 ? Integer.MAX_VALUE : Math.max(0, limit - attempts);
        return new RateLimitInfo(identity, kind, attempts, limit, windowMillis / 1000, remaining, snapshot[1]);
    }

    /**
     * 清除窗口外的记录，空桶直接删除。
     *
     * @return 删除的桶数
     */
    public int evictExpired() {
        long cutoff = clock.millis() - windowMillis;
        int[] removed = new int[1];
        for (BucketKey key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, window) -> {
                evictBefore(window, cutoff);
                if (window.isEmpty()) {
                    removed[0]++;
                    return null;
                }
                return window;
            });
        }
        return removed[0];
    }

    /**
     * 把每个桶的历史裁剪到 maxEntries 条以内（丢弃最早的）。
     * 上限不会低于该桶所属频道的限流值，否则裁剪会让窗口内放行数超过限额。
     *
     * @return 丢弃的记录数
     */
    public int trim(int maxEntries) {
        int[] dropped = new int[1];
        for (BucketKey key : buckets.keySet()) {
            int keep = Math.max(maxEntries, limitFor(key.kind()));
            buckets.computeIfPresent(key, (k, window) -> {
                while (window.size() > keep) {
                    window.pollFirst();
                    dropped[0]++;
                }
                return window.isEmpty() ? null : window;
            });
        }
        return dropped[0];
    }

    /** 清除某玩家的全部桶（玩家条目被回收时）。 */
    public void clear(String identity) {
        buckets.keySet().removeIf(key -> key.identity().equals(identity));
    }

    public RateLimiterStats stats() {
        long total = 0;
        for (Deque<Long> window : buckets.values()) {
            // size() 读取未加锁，统计值允许有偏差
            total += window.size();
        }
        return new RateLimiterStats(buckets.size(), total);
    }

    public int limitFor(ChannelKind kind) {
        return limits.getOrDefault(kind, 0);
    }

    private static void evictBefore(Deque<Long> window, long cutoff) {
        while (!window.isEmpty() && window.peekFirst() <= cutoff) {
            window.pollFirst();
        }
    }

    private record BucketKey(String identity, ChannelKind kind) {
    }
}
