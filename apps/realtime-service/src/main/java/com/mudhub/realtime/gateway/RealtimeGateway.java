package com.mudhub.realtime.gateway;

import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.realtime.dispatch.BroadcastDispatcher;
import com.mudhub.realtime.dispatch.SendResult;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.ConnectionSink;
import com.mudhub.session.RejectedConnectionException;
import com.mudhub.session.event.SessionInvalidatedEvent;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.TransportKind;
import com.mudhub.sessionkafkanotifier.publisher.SessionEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Optional;

/**
 * 传输层与游戏逻辑的统一入口。
 *
 * - 传输层（STOMP / SSE）通过 {@link #acceptConnection} / {@link #onConnectionClosed} 登记连接；
 * - 游戏逻辑通过 {@link #send} 发消息；
 * - 本实例上的会话切换/强制下线会通过 Kafka 通知其他实例（未配置 Kafka 时只影响本实例）。
 */
@Slf4j
public class RealtimeGateway {

    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final SessionAuthority authority;
    private final ObjectProvider<SessionEventPublisher> sessionEvents;
    private final RealtimeProperties properties;

    public RealtimeGateway(ConnectionRegistry registry,
                           BroadcastDispatcher dispatcher,
                           SessionAuthority authority,
                           ObjectProvider<SessionEventPublisher> sessionEvents,
                           RealtimeProperties properties) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.authority = authority;
        this.sessionEvents = sessionEvents;
        this.properties = properties;
    }

    /* =========================
     * 连接
     * ========================= */

    /**
     * 接入一条新连接。
     *
     * - 与认证侧权威会话不一致：拒绝；
     * - 与当前会话不一致：先开启新会话（踢掉旧会话的全部连接），再登记。
     *
     * @throws RejectedConnectionException 会话被拒绝
     */
    public ConnectionInfo acceptConnection(String identity, TransportKind kind, String sessionId, ConnectionSink sink) {
        if (identity == null || identity.isBlank() || sessionId == null || sessionId.isBlank()) {
            throw new RejectedConnectionException(identity, sessionId, "identity and session are required");
        }
        Optional<String> authoritative = authority.authoritativeSession(identity);
        if (authoritative.isPresent() && !authoritative.get().equals(sessionId)) {
            log.warn("【连接拒绝】会话已被认证侧作废: identity={}, offered={}, authoritative={}",
                    identity, sessionId, authoritative.get());
            throw new RejectedConnectionException(identity, sessionId, "session is no longer valid");
        }

        String current = registry.currentSession(identity).orElse(null);
        if (current != null && !current.equals(sessionId)) {
            List<String> evicted = registry.startNewSession(identity, sessionId);
            log.info("【会话切换】identity={}, {} -> {}, 踢掉 {} 个连接", identity, current, sessionId, evicted.size());
            notifyOtherInstances(SessionInvalidatedEvent.of(identity, sessionId,
                    SessionInvalidatedEvent.EventType.SESSION_REPLACED, "login from another session"));
        }
        return registry.register(identity, kind, sessionId, sink);
    }

    public void onConnectionClosed(String connectionId) {
        registry.unregister(connectionId);
    }

    /** 客户端有上行活动（发消息、心跳） */
    public void touch(String connectionId) {
        registry.touch(connectionId);
    }

    /**
     * 强制下线（运维操作），同时通知其他实例。
     */
    public List<String> disconnect(String identity, String reason) {
        List<String> closed = registry.forceDisconnect(identity, CloseReason.FORCED);
        notifyOtherInstances(SessionInvalidatedEvent.of(identity, null,
                SessionInvalidatedEvent.EventType.FORCE_LOGOUT, reason));
        return closed;
    }

    /* =========================
     * 发送
     * ========================= */

    /**
     * 游戏逻辑发送一条聊天消息（不回显给自己）。
     *
     * @throws IllegalArgumentException 消息为空
     */
    public SendResult send(String sender, ChannelKind kind, String payload, String target) {
        if (kind == ChannelKind.SYSTEM) {
            throw new IllegalArgumentException("system messages must be sent through sendSystem");
        }
        if (kind == ChannelKind.DIRECT && (target == null || target.isBlank())) {
            throw new IllegalArgumentException("target is required for direct messages");
        }
        return dispatcher.dispatch(sender, kind, sanitize(payload), target, false);
    }

    /** 回复最近的私聊对象 */
    public SendResult reply(String sender, String payload) {
        return dispatcher.reply(sender, sanitize(payload));
    }

    public SendResult sendSystem(String payload) {
        return dispatcher.sendSystem(sanitize(payload));
    }

    /* ============================
     * 内部工具
     * ============================ */

    private String sanitize(String content) {
        String trimmed = content == null ? "" : content.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("message must not be empty");
        }
        int maxLen = properties.getMaxMessageLength();
        if (trimmed.codePointCount(0, trimmed.length()) <= maxLen) {
            return trimmed;
        }
        // 按码点截断，不拆开代理对
        return trimmed.substring(0, trimmed.offsetByCodePoints(0, maxLen));
    }

    private void notifyOtherInstances(SessionInvalidatedEvent event) {
        SessionEventPublisher publisher = sessionEvents.getIfAvailable();
        if (publisher == null) {
            return;
        }
        event.setOrigin(properties.getInstanceId());
        publisher.publishSessionInvalidated(event);
    }
}
