package com.mudhub.realtime.ws;

import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.MessageKind;
import com.mudhub.session.model.RealtimeEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * WebSocket 断连工具类。
 * <p>
 * 职责：
 * - 向指定会话发送踢下线通知（KICK 信封）
 * - 向入站通道发送 DISCONNECT 命令，强制关闭指定 session
 */
@Slf4j
@Component
public class WebSocketDisconnectHelper {

    /** 踢人消息发送的目的地 */
    public static final String KICK_DESTINATION = "/queue/system.kick";

    private final SimpMessagingTemplate messagingTemplate;
    private final MessageChannel clientInboundChannel;
    private final Clock clock;

    public WebSocketDisconnectHelper(SimpMessagingTemplate messagingTemplate,
                                     @Qualifier("clientInboundChannel") MessageChannel clientInboundChannel,
                                     Clock clock) {
        this.messagingTemplate = messagingTemplate;
        this.clientInboundChannel = clientInboundChannel;
        this.clock = clock;
    }

    /**
     * 发送踢人通知到指定玩家的指定 session。
     */
    public void sendKickMessage(String identity, String wsSessionId, CloseReason reason, String message) {
        try {
            RealtimeEnvelope kick = RealtimeEnvelope.builder()
                    .kind(MessageKind.KICK)
                    .channel(reason.name())
                    .targetId(identity)
                    .payload(message)
                    .timestamp(clock.millis())
                    .build();
            messagingTemplate.convertAndSendToUser(identity, KICK_DESTINATION, kick, sessionHeaders(wsSessionId));
        } catch (Exception e) {
            log.warn("发送踢人通知失败: identity={}, sessionId={}", identity, wsSessionId, e);
        }
    }

    /**
     * 强制断开 WebSocket 连接。
     */
    public void forceDisconnect(String wsSessionId) {
        try {
            StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
            header.setSessionId(wsSessionId);
            header.setLeaveMutable(true);
            clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        } catch (Exception e) {
            log.warn("强制断开连接失败: sessionId={}", wsSessionId, e);
        }
    }

    /** 只投递给指定 STOMP 会话的消息头 */
    static MessageHeaders sessionHeaders(String wsSessionId) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(wsSessionId);
        headerAccessor.setLeaveMutable(true);
        return headerAccessor.getMessageHeaders();
    }
}
