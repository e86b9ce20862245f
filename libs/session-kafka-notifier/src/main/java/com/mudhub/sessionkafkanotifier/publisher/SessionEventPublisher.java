package com.mudhub.sessionkafkanotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.mudhub.session.event.SessionInvalidatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 会话事件发布器：把本实例上发生的会话切换/强制下线通知给其他实例。
 *
 * 以 identity 作为消息 key，同一玩家的事件落在同一分区，保证顺序。
 * 发布失败只记录日志，不影响本地处理。
 */
@Slf4j
@Component
public class SessionEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${session.kafka.topic:mud-session-invalidated}")
    private String topic;

    @Value("${instance.id:${spring.application.name:realtime}}")
    private String instanceId;

    public SessionEventPublisher(@Qualifier("sessionKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    public void publishSessionInvalidated(String identity, String sessionId,
                                          SessionInvalidatedEvent.EventType eventType, String reason) {
        publishSessionInvalidated(SessionInvalidatedEvent.of(identity, sessionId, eventType, reason));
    }

    /**
     * 发布会话失效事件。未设置 origin 时填入本实例 ID。
     */
    public void publishSessionInvalidated(SessionInvalidatedEvent event) {
        if (event.getOrigin() == null) {
            event.setOrigin(instanceId);
        }
        try {
            String message = JSON.toJSONString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, event.getIdentity(), message);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("会话失效事件发布成功: identity={}, type={}, offset={}",
                            event.getIdentity(), event.getEventType(), result.getRecordMetadata().offset());
                } else {
                    log.error("会话失效事件发布失败: identity={}", event.getIdentity(), ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("发布会话失效事件异常: identity={}", event.getIdentity(), e);
        }
    }
}
