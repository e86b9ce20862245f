package com.mudhub.realtime.ws;

import com.mudhub.realtime.gateway.RealtimeGateway;
import com.mudhub.session.RejectedConnectionException;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.TransportKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * STOMP 会话与注册表连接之间的映射。
 *
 * - CONNECT：记录活跃的 STOMP 会话；
 * - 订阅 /user/queue/events 生效：经网关登记连接，会话被拒绝时踢下线；
 * - DISCONNECT：注销连接。
 *
 * 订阅事件与断开事件可能在不同线程上交错，两边都检查对方的结果，注销是幂等的。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final RealtimeGateway gateway;
    private final SimpMessagingTemplate messagingTemplate;
    private final WebSocketDisconnectHelper disconnectHelper;

    /** 已 CONNECT 且尚未断开的 STOMP 会话 */
    private final Set<String> activeSessions = ConcurrentHashMap.newKeySet();
    /** STOMP sessionId -> 注册表 connectionId */
    private final Map<String, String> connections = new ConcurrentHashMap<>();

    public WebSocketSessionManager(RealtimeGateway gateway,
                                   SimpMessagingTemplate messagingTemplate,
                                   WebSocketDisconnectHelper disconnectHelper) {
        this.gateway = gateway;
        this.messagingTemplate = messagingTemplate;
        this.disconnectHelper = disconnectHelper;
    }

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        String wsSessionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        if (wsSessionId != null) {
            activeSessions.add(wsSessionId);
        }
    }

    @EventListener
    public void handleEventsSubscribed(EventsSubscribedEvent event) {
        String wsSessionId = event.getWsSessionId();
        StompPrincipal principal = event.getPrincipal();
        if (!activeSessions.contains(wsSessionId) || connections.containsKey(wsSessionId)) {
            return;
        }

        StompConnectionSink sink = new StompConnectionSink(principal.identity(), wsSessionId, messagingTemplate, disconnectHelper);
        ConnectionInfo connection;
        try {
            connection = gateway.acceptConnection(principal.identity(), TransportKind.BIDIRECTIONAL_SOCKET,
                    principal.gameSession(), sink);
        } catch (RejectedConnectionException e) {
            log.warn("【WS】连接被拒绝: identity={}, session={}, sessionId={}, reason={}",
                    principal.identity(), principal.gameSession(), wsSessionId, e.getMessage());
            disconnectHelper.sendKickMessage(principal.identity(), wsSessionId, CloseReason.SESSION_REPLACED, e.getMessage());
            disconnectHelper.forceDisconnect(wsSessionId);
            return;
        }

        connections.put(wsSessionId, connection.getConnectionId());
        if (!activeSessions.contains(wsSessionId)) {
            // 登记期间客户端已断开
            connections.remove(wsSessionId);
            gateway.onConnectionClosed(connection.getConnectionId());
            return;
        }
        log.info("【WS】连接登记: identity={}, sessionId={}, connectionId={}",
                principal.identity(), wsSessionId, connection.getConnectionId());
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String wsSessionId = event.getSessionId();
        activeSessions.remove(wsSessionId);
        String connectionId = connections.remove(wsSessionId);
        if (connectionId != null) {
            gateway.onConnectionClosed(connectionId);
            log.info("【WS】连接断开: sessionId={}, connectionId={}, status={}", wsSessionId, connectionId, event.getCloseStatus());
        }
    }

    /** 客户端上行活动 */
    public void touch(String wsSessionId) {
        if (wsSessionId == null) {
            return;
        }
        String connectionId = connections.get(wsSessionId);
        if (connectionId != null) {
            gateway.touch(connectionId);
        }
    }

    public Optional<String> connectionIdOf(String wsSessionId) {
        return Optional.ofNullable(connections.get(wsSessionId));
    }

    public int activeSessionCount() {
        return activeSessions.size();
    }
}
