package com.mudhub.realtime.janitor;

import com.mudhub.realtime.bus.LocationMembershipSync;
import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.realtime.pending.PendingMessageBuffer;
import com.mudhub.realtime.ratelimit.RateLimiter;
import com.mudhub.realtime.routing.ChannelRouter;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.ConnectionInfo;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 连接与内存清理任务。
 *
 * 每个检查周期判断一次：距上次清理超过 cleanupInterval，或堆内存使用率超过阈值时执行清理。
 * 清理步骤：
 * (a) 回收不健康的连接，以及存活过久且空闲过久的连接；
 * (b) 丢弃过期的暂存消息；
 * (c) 删除窗口外的限流记录；
 * (d) 裁剪暂存队列与限流历史到上限；
 * (e) 回收长时间无连接的玩家条目。
 */
@Slf4j
public class ConnectionJanitor {

    private final ConnectionRegistry registry;
    private final PendingMessageBuffer pending;
    private final RateLimiter rateLimiter;
    private final ChannelRouter router;
    private final LocationMembershipSync locationSync;
    private final RealtimeProperties.Janitor config;
    private final MemoryProbe memoryProbe;
    private final Clock clock;

    private final AtomicLong cleanups = new AtomicLong();
    private final AtomicLong timeBased = new AtomicLong();
    private final AtomicLong memoryBased = new AtomicLong();
    private final AtomicLong forced = new AtomicLong();

    private volatile long lastCleanupAt;
    private volatile CleanupReport lastReport;
    private volatile ScheduledFuture<?> task;

    public ConnectionJanitor(ConnectionRegistry registry,
                             PendingMessageBuffer pending,
                             RateLimiter rateLimiter,
                             ChannelRouter router,
                             LocationMembershipSync locationSync,
                             RealtimeProperties.Janitor config,
                             MemoryProbe memoryProbe,
                             Clock clock) {
        this.registry = registry;
        this.pending = pending;
        this.rateLimiter = rateLimiter;
        this.router = router;
        this.locationSync = locationSync;
        this.config = config;
        this.memoryProbe = memoryProbe;
        this.clock = clock;
        this.lastCleanupAt = clock.millis();
    }

    /**
     * 在给定调度器上按 checkInterval 周期运行。
     */
    public synchronized void start(ScheduledExecutorService scheduler) {
        if (task != null) {
            return;
        }
        long period = config.getCheckInterval().toMillis();
        task = scheduler.scheduleAtFixedRate(this::checkSafely, period, period, TimeUnit.MILLISECONDS);
        log.info("【清理任务】已启动: checkInterval={}s, cleanupInterval={}s, memoryThreshold={}",
                period / 1000, config.getCleanupInterval().toSeconds(), config.getMemoryThreshold());
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    /**
     * 一次检查：满足条件才清理。
     *
     * @return 执行了清理时返回报告，否则返回 null
     */
    public CleanupReport check() {
        long now = clock.millis();
        if (now - lastCleanupAt >= config.getCleanupInterval().toMillis()) {
            return sweep(CleanupTrigger.TIME);
        }
        double usage = memoryProbe.usageRatio();
        if (usage > config.getMemoryThreshold()) {
            log.warn("【清理任务】内存使用率过高，立即清理: usage={}", String.format("%.2f", usage));
            return sweep(CleanupTrigger.MEMORY);
        }
        return null;
    }

    /** 运维手动触发清理。 */
    public CleanupReport forceSweep() {
        return sweep(CleanupTrigger.FORCED);
    }

    public synchronized CleanupReport sweep(CleanupTrigger trigger) {
        long started = clock.millis();
        CleanupReport report = CleanupReport.builder()
                .trigger(trigger)
                .startedAt(started)
                .memoryUsage(memoryProbe.usageRatio())
                .build();

        // (a) 连接
        long maxAge = config.getMaxConnectionAge().toMillis();
        long maxIdle = config.getMaxIdle().toMillis();
        for (ConnectionInfo connection : registry.allConnections()) {
            if (!connection.isHealthy()) {
                if (registry.evict(connection.getConnectionId(), CloseReason.UNHEALTHY)) {
                    report.setUnhealthyConnections(report.getUnhealthyConnections() + 1);
                }
            } else if (connection.ageMillis(started) > maxAge && connection.idleMillis(started) > maxIdle) {
                if (registry.evict(connection.getConnectionId(), CloseReason.STALE)) {
                    report.setStaleConnections(report.getStaleConnections() + 1);
                }
            }
        }

        // (b) 过期暂存消息  (c) 过期限流记录
        report.setExpiredPendingMessages(pending.purgeExpired());
        report.setExpiredRateBuckets(rateLimiter.evictExpired());

        // (d) 上限裁剪
        report.setTrimmedPendingMessages(pending.trim(config.getMaxPendingMessages()));
        report.setTrimmedRateEntries(rateLimiter.trim(config.getMaxRateLimitEntries()));

        // (e) 空闲玩家条目
        List<String> pruned = registry.pruneIdleIdentities();
        for (String identity : pruned) {
            router.forget(identity);
            rateLimiter.clear(identity);
            pending.clear(identity);
        }
        report.setPrunedIdentities(pruned.size());
        report.setReleasedSubscriptions(locationSync.reconcile());

        long finished = clock.millis();
        report.setDurationMillis(finished - started);
        lastCleanupAt = finished;
        lastReport = report;
        cleanups.incrementAndGet();
        switch (trigger) {
            case TIME -> timeBased.incrementAndGet();
            case MEMORY -> memoryBased.incrementAndGet();
            case FORCED -> forced.incrementAndGet();
        }

        log.info("【清理任务】完成: trigger={}, closed={}, expiredPending={}, expiredBuckets={}, pruned={}, cost={}ms",
                trigger, report.getClosedConnections(), report.getExpiredPendingMessages(),
                report.getExpiredRateBuckets(), report.getPrunedIdentities(), report.getDurationMillis());
        return report;
    }

    public JanitorStats stats() {
        return new JanitorStats(cleanups.get(), timeBased.get(), memoryBased.get(), forced.get(),
                lastCleanupAt, memoryProbe.usageRatio(), lastReport);
    }

    /** 调度线程上的异常不能逃逸，否则 scheduleAtFixedRate 会停止后续执行。 */
    private void checkSafely() {
        try {
            check();
        } catch (RuntimeException e) {
            log.error("【清理任务】执行异常", e);
        }
    }
}
