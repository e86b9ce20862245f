package com.mudhub.realtime.gateway;

import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.event.SessionInvalidatedEvent;
import com.mudhub.session.model.CloseReason;
import com.mudhub.sessionkafkanotifier.listener.SessionEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 会话失效事件监听器：其他实例上发生会话切换或强制下线时，同步处理本实例上的连接。
 *
 * - SESSION_REPLACED：本地切换到新会话，旧会话的连接被关闭；
 * - 其他类型：关闭该玩家的全部本地连接并结束会话。
 *
 * 本实例自己发出的事件直接忽略。
 */
@Slf4j
@Component
public class SessionInvalidatedListener implements SessionEventListener {

    private final ConnectionRegistry registry;
    private final RealtimeProperties properties;

    public SessionInvalidatedListener(ConnectionRegistry registry, RealtimeProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void onSessionInvalidated(SessionInvalidatedEvent event) {
        if (properties.getInstanceId().equals(event.getOrigin())) {
            return;
        }
        String identity = event.getIdentity();
        if (!registry.isKnown(identity)) {
            return;
        }
        SessionInvalidatedEvent.EventType type = event.getEventType() == null
                ? SessionInvalidatedEvent.EventType.OTHER : event.getEventType();
        log.info("【会话事件】收到: identity={}, sessionId={}, type={}, origin={}, reason={}",
                identity, event.getSessionId(), type, event.getOrigin(), resolveReason(event));

        List<String> closed;
        if (type == SessionInvalidatedEvent.EventType.SESSION_REPLACED
                && event.getSessionId() != null && !event.getSessionId().isBlank()) {
            closed = registry.startNewSession(identity, event.getSessionId());
        } else {
            closed = registry.forceDisconnect(identity, CloseReason.FORCED);
        }

        if (!closed.isEmpty()) {
            log.info("【会话事件】已断开本地连接: identity={}, count={}", identity, closed.size());
        }
    }

    private String resolveReason(SessionInvalidatedEvent event) {
        if (event.getReason() != null && !event.getReason().isBlank()) {
            return event.getReason();
        }
        return switch (event.getEventType() == null ? SessionInvalidatedEvent.EventType.OTHER : event.getEventType()) {
            case SESSION_REPLACED -> "logged in from another session";
            case LOGOUT -> "logged out";
            case FORCE_LOGOUT -> "disconnected by an operator";
            case OTHER -> "session invalidated";
        };
    }
}
