package com.mudhub.realtime.ws;

import com.mudhub.session.ConnectionSink;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.RealtimeEnvelope;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * 一个 STOMP 会话上的事件出口：消息只投递到该会话的 /user/queue/events。
 */
public class StompConnectionSink implements ConnectionSink {

    public static final String EVENTS_QUEUE = "/queue/events";

    private final String identity;
    private final String wsSessionId;
    private final SimpMessagingTemplate messagingTemplate;
    private final WebSocketDisconnectHelper disconnectHelper;

    public StompConnectionSink(String identity, String wsSessionId,
                               SimpMessagingTemplate messagingTemplate,
                               WebSocketDisconnectHelper disconnectHelper) {
        this.identity = identity;
        this.wsSessionId = wsSessionId;
        this.messagingTemplate = messagingTemplate;
        this.disconnectHelper = disconnectHelper;
    }

    @Override
    public void send(RealtimeEnvelope envelope) {
        messagingTemplate.convertAndSendToUser(identity, EVENTS_QUEUE, envelope,
                WebSocketDisconnectHelper.sessionHeaders(wsSessionId));
    }

    @Override
    public void close(CloseReason reason, String message) {
        disconnectHelper.sendKickMessage(identity, wsSessionId, reason, message);
        disconnectHelper.forceDisconnect(wsSessionId);
    }

    public String getWsSessionId() {
        return wsSessionId;
    }
}
