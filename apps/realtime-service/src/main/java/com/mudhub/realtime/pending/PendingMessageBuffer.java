package com.mudhub.realtime.pending;

import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.session.model.RealtimeEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 离线暂存缓冲：收件人暂时没有连接但仍在重连窗口内时，消息先放在这里。
 *
 * - 每个玩家一个有界队列，超出上限丢弃最早的消息；
 * - {@link #drain} 是破坏性读取：队列整体摘下，过期消息不返回；
 * - 每个队列自身作为监视器，drain 之后队列作废（drained），
 *   与之并发的 enqueue 会重新拿新队列，不会把消息写进已摘下的队列里。
 */
@Slf4j
public class PendingMessageBuffer {

    private final ConcurrentMap<String, PendingQueue> queues = new ConcurrentHashMap<>();
    private final int maxPerIdentity;
    private final Duration defaultTtl;
    private final Clock clock;

    private final AtomicLong evictedTotal = new AtomicLong();
    private final AtomicLong expiredTotal = new AtomicLong();

    public PendingMessageBuffer(RealtimeProperties.Pending config, Clock clock) {
        this(config.getMaxPerIdentity(), config.getTtl(), clock);
    }

    public PendingMessageBuffer(int maxPerIdentity, Duration defaultTtl, Clock clock) {
        if (maxPerIdentity <= 0) {
            throw new IllegalArgumentException("maxPerIdentity must be positive");
        }
        this.maxPerIdentity = maxPerIdentity;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public void enqueue(String identity, RealtimeEnvelope envelope) {
        enqueue(identity, envelope, defaultTtl);
    }

    /**
     * 暂存一条消息。队列已满时丢弃最早的一条。
     */
    public void enqueue(String identity, RealtimeEnvelope envelope, Duration ttl) {
        PendingMessage message = new PendingMessage(identity, envelope, clock.millis(), ttl.toMillis());
        while (true) {
            PendingQueue queue = queues.computeIfAbsent(identity, k -> new PendingQueue());
            synchronized (queue) {
                if (queue.drained) {
                    continue;
                }
                queue.messages.addLast(message);
                while (queue.messages.size() > maxPerIdentity) {
                    queue.messages.pollFirst();
                    evictedTotal.incrementAndGet();
                }
                return;
            }
        }
    }

    /**
     * 取出并清空该玩家的暂存消息（按入队顺序），过期的不返回。
     */
    public List<RealtimeEnvelope> drain(String identity) {
        PendingQueue queue = queues.remove(identity);
        if (queue == null) {
            return List.of();
        }
        long now = clock.millis();
        List<RealtimeEnvelope> result;
        synchronized (queue) {
            queue.drained = true;
            result = new ArrayList<>(queue.messages.size());
            for (PendingMessage message : queue.messages) {
                if (message.isExpired(now)) {
                    expiredTotal.incrementAndGet();
                } else {
                    result.add(message.envelope());
                }
            }
            queue.messages.clear();
        }
        if (!result.isEmpty()) {
            log.debug("取出暂存消息: identity={}, count={}", identity, result.size());
        }
        return result;
    }

    /**
     * 丢弃所有过期消息，空队列一并移除。
     *
     * @return 丢弃的消息数
     */
    public int purgeExpired() {
        long now = clock.millis();
        int purged = 0;
        for (Map.Entry<String, PendingQueue> entry : queues.entrySet()) {
            PendingQueue queue = entry.getValue();
            synchronized (queue) {
                if (queue.drained) {
                    continue;
                }
                int before = queue.messages.size();
                queue.messages.removeIf(message -> message.isExpired(now));
                purged += before - queue.messages.size();
                retireIfEmpty(entry.getKey(), queue);
            }
        }
        expiredTotal.addAndGet(purged);
        return purged;
    }

    /**
     * 把每个队列裁剪到 max 条以内（丢弃最早的）。
     *
     * @return 丢弃的消息数
     */
    public int trim(int max) {
        int dropped = 0;
        for (Map.Entry<String, PendingQueue> entry : queues.entrySet()) {
            PendingQueue queue = entry.getValue();
            synchronized (queue) {
                if (queue.drained) {
                    continue;
                }
                while (queue.messages.size() > max) {
                    queue.messages.pollFirst();
                    dropped++;
                }
                retireIfEmpty(entry.getKey(), queue);
            }
        }
        evictedTotal.addAndGet(dropped);
        return dropped;
    }

    public int size(String identity) {
        PendingQueue queue = queues.get(identity);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            return queue.messages.size();
        }
    }

    /** 丢弃某玩家的全部暂存消息。 */
    public int clear(String identity) {
        PendingQueue queue = queues.remove(identity);
        if (queue == null) {
            return 0;
        }
        synchronized (queue) {
            queue.drained = true;
            int count = queue.messages.size();
            queue.messages.clear();
            return count;
        }
    }

    public PendingBufferStats stats() {
        long total = 0;
        int identities = 0;
        for (PendingQueue queue : queues.values()) {
            synchronized (queue) {
                if (!queue.messages.isEmpty()) {
                    identities++;
                    total += queue.messages.size();
                }
            }
        }
        return new PendingBufferStats(identities, total, evictedTotal.get(), expiredTotal.get());
    }

    /** 调用方持有 queue 锁。 */
    private void retireIfEmpty(String identity, PendingQueue queue) {
        if (queue.messages.isEmpty()) {
            queue.drained = true;
            queues.remove(identity, queue);
        }
    }

    private static final class PendingQueue {
        final Deque<PendingMessage> messages = new ArrayDeque<>();
        boolean drained;
    }
}
