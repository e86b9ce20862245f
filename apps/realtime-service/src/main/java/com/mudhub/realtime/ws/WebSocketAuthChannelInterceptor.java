package com.mudhub.realtime.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHandler;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.simp.user.UserDestinationMessageHandler;
import org.springframework.messaging.support.ExecutorChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

/**
 * STOMP 入站拦截器。
 *
 * - CONNECT：从 STOMP 头读取 identity 与 game-session，设置为连接主体；
 * - SUBSCRIBE /user/queue/events：用户目的地订阅处理完成后发布 {@link EventsSubscribedEvent}。
 *
 * 身份认证由上游网关完成，这里只信任网关透传的头。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ExecutorChannelInterceptor {

    public static final String IDENTITY_HEADER = "identity";
    public static final String GAME_SESSION_HEADER = "game-session";
    public static final String EVENTS_DESTINATION = "/user/queue/events";

    private final ApplicationEventPublisher eventPublisher;

    public WebSocketAuthChannelInterceptor(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        String identity = accessor.getFirstNativeHeader(IDENTITY_HEADER);
        String gameSession = accessor.getFirstNativeHeader(GAME_SESSION_HEADER);
        if (identity == null || identity.isBlank() || gameSession == null || gameSession.isBlank()) {
            log.warn("【WS】CONNECT 缺少 identity 或 game-session 头: sessionId={}", accessor.getSessionId());
            return message;
        }

        accessor.setUser(new StompPrincipal(identity.strip(), gameSession.strip()));
        log.debug("【WS】CONNECT 通过: identity={}, sessionId={}", identity, accessor.getSessionId());
        return message;
    }

    @Override
    public void afterMessageHandled(Message<?> message, MessageChannel channel, MessageHandler handler, Exception ex) {
        if (ex != null || !(handler instanceof UserDestinationMessageHandler)) {
            return;
        }
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null
                || !StompCommand.SUBSCRIBE.equals(accessor.getCommand())
                || !EVENTS_DESTINATION.equals(accessor.getDestination())) {
            return;
        }
        if (!(accessor.getUser() instanceof StompPrincipal principal)) {
            log.warn("【WS】未认证的会话订阅事件队列，忽略: sessionId={}", accessor.getSessionId());
            return;
        }
        eventPublisher.publishEvent(new EventsSubscribedEvent(this, accessor.getSessionId(), principal));
    }
}
