package com.mudhub.sessionkafkanotifier.listener;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.mudhub.session.event.SessionInvalidatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 会话事件消费者。
 *
 * 监听 Kafka 中的会话失效事件并分发给所有 {@link SessionEventListener}。
 * 手动提交 offset：只有全部监听器处理成功才提交。
 */
@Slf4j
@Component
public class SessionEventConsumer {

    private final List<SessionEventListener> listeners;

    @Autowired(required = false)
    public SessionEventConsumer(List<SessionEventListener> listeners) {
        this.listeners = listeners != null ? listeners : List.of();
        log.info("会话事件消费者初始化完成，发现 {} 个监听器", this.listeners.size());
    }

    @KafkaListener(topics = "${session.kafka.topic:mud-session-invalidated}",
                   containerFactory = "sessionKafkaListenerContainerFactory")
    public void consumeSessionInvalidated(String message, Acknowledgment ack) {
        SessionInvalidatedEvent event;
        try {
            event = JSON.parseObject(message, SessionInvalidatedEvent.class);
        } catch (JSONException e) {
            // 格式错误的消息重试也不会成功，提交掉避免阻塞分区
            log.error("会话失效事件格式错误，丢弃: message={}", message, e);
            ack.acknowledge();
            return;
        }
        if (event == null || event.getIdentity() == null) {
            log.warn("会话失效事件缺少 identity，丢弃: message={}", message);
            ack.acknowledge();
            return;
        }

        if (dispatch(event)) {
            ack.acknowledge();
            log.debug("会话失效事件处理完成并提交: identity={}, type={}", event.getIdentity(), event.getEventType());
        } else {
            log.warn("会话失效事件部分监听器失败，不提交 offset: identity={}", event.getIdentity());
        }
    }

    /**
     * 调用全部监听器。
     *
     * @return 是否全部成功
     */
    boolean dispatch(SessionInvalidatedEvent event) {
        if (listeners.isEmpty()) {
            log.warn("收到会话失效事件，但未发现任何 SessionEventListener 实现: identity={}", event.getIdentity());
            return true;
        }
        boolean allSuccess = true;
        for (SessionEventListener listener : listeners) {
            try {
                listener.onSessionInvalidated(event);
            } catch (RuntimeException e) {
                log.error("监听器处理会话失效事件失败: listener={}, identity={}",
                        listener.getClass().getName(), event.getIdentity(), e);
                allSuccess = false;
            }
        }
        return allSuccess;
    }
}
