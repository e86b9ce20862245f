package com.mudhub.realtime.bus;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.session.PresenceTransition;
import com.mudhub.session.RegistryListener;
import com.mudhub.session.model.RealtimeEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 本地分发与外部 Broker 之间的桥。
 *
 * 出站：所有发布/订阅操作都在一个专用线程上按 FIFO 执行，Broker 不可用时指数退避重试
 * （降级模式下本地投递照常进行）。
 * 入站：用 fastjson2 解析消息信封，丢弃本实例自己发出的回声，其余交给 {@link InboundHandler}。
 *
 * 发布任务受队列容量限制，队列满时丢弃并计数；订阅/取消订阅任务不受容量限制，永不丢弃。
 *
 * 主题订阅按引用计数管理：计数从 0 变 1 时真正订阅，从 1 变 0 时取消。
 * 私聊主题跟随玩家在线状态（作为注册表监听器），全服/系统主题在启动时订阅。
 */
@Slf4j
public class BrokerBridge implements EnvelopePublisher, RegistryListener {

    private final BrokerClient client;
    private final SubjectNames subjects;
    private final String instanceId;
    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final int queueCapacity;
    private final ThreadPoolExecutor worker;

    /** 主题 -> 引用计数（受 this 监视器保护） */
    private final Map<String, Integer> refCounts = new HashMap<>();
    /** 主题 -> 订阅句柄（只在 worker 线程访问） */
    private final Map<String, BrokerClient.Subscription> active = new HashMap<>();

    private volatile InboundHandler inboundHandler = (kind, param, envelope) -> { };
    private volatile boolean degraded;
    private volatile boolean stopping;

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong echoes = new AtomicLong();
    private final AtomicLong relayed = new AtomicLong();

    public BrokerBridge(BrokerClient client, SubjectNames subjects, String instanceId, RealtimeProperties.Broker config) {
        this.client = client;
        this.subjects = subjects;
        this.instanceId = instanceId;
        this.initialDelayMillis = Math.max(1, config.getRetryInitialDelay().toMillis());
        this.maxDelayMillis = Math.max(initialDelayMillis, config.getRetryMaxDelay().toMillis());
        this.queueCapacity = Math.max(1, config.getQueueCapacity());

        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "broker-bridge-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), tf,
                (task, executor) -> log.debug("【Broker】桥接已停止，忽略任务"));
    }

    public void setInboundHandler(InboundHandler inboundHandler) {
        this.inboundHandler = inboundHandler;
    }

    /** 订阅全服与系统主题。 */
    public void start() {
        acquire(subjects.global());
        acquire(subjects.system());
        log.info("【Broker】桥接启动: client={}, root={}, instance={}", client.name(), subjects.root(), instanceId);
    }

    public void stop() {
        stopping = true;
        worker.execute(() -> {
            active.values().forEach(BrokerClient.Subscription::cancel);
            active.clear();
        });
        worker.shutdown();
        try {
            if (!worker.awaitTermination(2, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("【Broker】桥接已停止: published={}, dropped={}", published.get(), dropped.get());
    }

    /* =========================
     * 出站
     * ========================= */

    @Override
    public void publish(String subject, RealtimeEnvelope envelope) {
        if (stopping) {
            return;
        }
        int queued = worker.getQueue().size();
        if (queued >= queueCapacity) {
            dropped.incrementAndGet();
            log.warn("【Broker】发布队列已满，丢弃消息: subject={}, queueSize={}", subject, queued);
            return;
        }
        worker.execute(() -> {
            String body = JSON.toJSONString(envelope);
            if (runWithRetry("publish " + subject, () -> client.publish(subject, body))) {
                published.incrementAndGet();
            }
        });
    }

    /* =========================
     * 订阅（引用计数）
     * ========================= */

    public void acquire(String subject) {
        synchronized (this) {
            int count = refCounts.merge(subject, 1, Integer::sum);
            if (count > 1) {
                return;
            }
        }
        worker.execute(() -> syncSubscription(subject));
    }

    public void release(String subject) {
        synchronized (this) {
            Integer count = refCounts.get(subject);
            if (count == null) {
                return;
            }
            if (count > 1) {
                refCounts.put(subject, count - 1);
                return;
            }
            refCounts.remove(subject);
        }
        worker.execute(() -> syncSubscription(subject));
    }

    public synchronized int refCount(String subject) {
        return refCounts.getOrDefault(subject, 0);
    }

    /** 在 worker 线程上让实际订阅与引用计数一致。 */
    private void syncSubscription(String subject) {
        boolean wanted = refCount(subject) > 0;
        BrokerClient.Subscription current = active.get(subject);
        if (wanted && current == null) {
            runWithRetry("subscribe " + subject, () -> active.put(subject, client.subscribe(subject, this::onMessage)));
        } else if (!wanted && current != null) {
            active.remove(subject).cancel();
        }
    }

    /* =========================
     * 在线状态 -> 私聊主题
     * ========================= */

    @Override
    public void onPresenceChanged(PresenceTransition transition) {
        String identity = transition.getIdentity();
        if (!subjects.isValidToken(identity)) {
            log.warn("玩家标识不能作为主题参数，跳过私聊主题订阅: identity={}", identity);
            return;
        }
        if (transition.isEntered()) {
            acquire(subjects.direct(identity));
        } else {
            release(subjects.direct(identity));
        }
    }

    /* =========================
     * 入站
     * ========================= */

    void onMessage(String subject, String body) {
        SubjectNames.ParsedSubject parsed = subjects.parse(subject).orElse(null);
        if (parsed == null) {
            log.warn("【Broker】无法识别的主题: subject={}", subject);
            return;
        }
        RealtimeEnvelope envelope;
        try {
            envelope = JSON.parseObject(body, RealtimeEnvelope.class);
        } catch (JSONException e) {
            log.warn("【Broker】消息解析失败: subject={}, error={}", subject, e.getMessage());
            return;
        }
        if (envelope == null) {
            return;
        }
        if (instanceId.equals(envelope.getOrigin())) {
            echoes.incrementAndGet();
            return;
        }
        try {
            inboundHandler.handle(parsed.kind(), parsed.param(), envelope);
            relayed.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("【Broker】入站消息投递失败: subject={}, seq={}", subject, envelope.getSequence(), e);
        }
    }

    /* ============================
     * 内部工具
     * ============================ */

    /**
     * 执行 Broker 操作，失败时指数退避重试直到成功或桥接停止。
     *
     * @return 是否最终成功
     */
    private boolean runWithRetry(String action, Runnable operation) {
        long delay = initialDelayMillis;
        while (true) {
            try {
                operation.run();
                if (degraded) {
                    degraded = false;
                    log.info("【Broker】连接恢复，退出降级模式: action={}", action);
                }
                return true;
            } catch (BrokerUnavailableException e) {
                if (!degraded) {
                    degraded = true;
                    log.warn("【Broker】不可用，进入降级模式（仅本地投递）: action={}, error={}", action, e.getMessage());
                }
                if (stopping) {
                    return false;
                }
                retries.incrementAndGet();
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("【Broker】重试被中断，放弃: action={}", action);
                    return false;
                }
                delay = Math.min(delay * 2, maxDelayMillis);
            }
        }
    }

    /**
     * 等待当前已提交的任务全部执行完（测试与优雅停机使用）。
     */
    public boolean flush(Duration timeout) {
        Future<?> marker = worker.submit(() -> { });
        try {
            marker.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("broker worker failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isDegraded() {
        return degraded;
    }

    public BrokerStats stats() {
        int subscriptions;
        synchronized (this) {
            subscriptions = refCounts.size();
        }
        return new BrokerStats(client.name(), degraded, worker.getQueue().size(), subscriptions,
                published.get(), retries.get(), dropped.get(), echoes.get(), relayed.get());
    }

    /**
     * 入站消息处理器（通常是分发器的 relayInbound）。
     */
    @FunctionalInterface
    public interface InboundHandler {
        void handle(ChannelKind kind, String subjectParam, RealtimeEnvelope envelope);
    }
}
