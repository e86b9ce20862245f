package com.mudhub.realtime.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内 Broker（realtime.broker.type=in-memory）：单实例部署与测试使用。
 *
 * 发布时同步回调订阅者；可以通过 {@link #setAvailable(boolean)} 模拟 Broker 故障。
 */
@Slf4j
public class InMemoryBrokerClient implements BrokerClient {

    private final ConcurrentMap<String, List<MessageHandler>> handlers = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public void publish(String subject, String message) {
        ensureAvailable();
        List<MessageHandler> targets = handlers.get(subject);
        if (targets == null) {
            return;
        }
        for (MessageHandler handler : targets) {
            try {
                handler.onMessage(subject, message);
            } catch (RuntimeException e) {
                log.error("进程内 Broker 订阅者处理失败: subject={}", subject, e);
            }
        }
    }

    @Override
    public Subscription subscribe(String subject, MessageHandler handler) {
        ensureAvailable();
        handlers.computeIfAbsent(subject, k -> new CopyOnWriteArrayList<>()).add(handler);
        return new Subscription() {
            @Override
            public String subject() {
                return subject;
            }

            @Override
            public void cancel() {
                handlers.computeIfPresent(subject, (k, list) -> {
                    list.remove(handler);
                    return list.isEmpty() ? null : list;
                });
            }
        };
    }

    @Override
    public String name() {
        return "in-memory";
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int subscriberCount(String subject) {
        List<MessageHandler> list = handlers.get(subject);
        return list == null ? 0 : list.size();
    }

    private void ensureAvailable() {
        if (!available) {
            throw new BrokerUnavailableException("in-memory broker is marked unavailable");
        }
    }
}
