package com.mudhub.realtime.ws;

import com.mudhub.realtime.RealtimeTestKit;
import com.mudhub.realtime.gateway.RealtimeGateway;
import com.mudhub.realtime.gateway.SessionAuthority;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.RealtimeEnvelope;
import com.mudhub.session.model.TransportKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WebSocketSessionManagerTest {

    private RealtimeTestKit kit;
    private SimpMessagingTemplate template;
    private WebSocketDisconnectHelper disconnectHelper;
    private WebSocketSessionManager manager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kit = new RealtimeTestKit();
        template = mock(SimpMessagingTemplate.class);
        disconnectHelper = mock(WebSocketDisconnectHelper.class);
        RealtimeGateway gateway = new RealtimeGateway(kit.registry, kit.dispatcher, SessionAuthority.newestWins(),
                mock(ObjectProvider.class), kit.properties);
        manager = new WebSocketSessionManager(gateway, template, disconnectHelper);
    }

    @AfterEach
    void tearDown() {
        kit.close();
    }

    @Test
    void subscribe_registersConnectionAndRoutesEventsToThatSession() {
        kit.locationSync.updateLocation("alice", "tavern");
        kit.join("bob", "tavern", "s-bob");

        manager.handleSessionConnect(connectEvent("ws-1"));
        manager.handleEventsSubscribed(subscribed("ws-1", "alice", "s1"));

        assertTrue(manager.connectionIdOf("ws-1").isPresent());
        assertEquals(TransportKind.BIDIRECTIONAL_SOCKET, kit.onlyConnection("alice").getTransportKind());

        kit.dispatcher.dispatch("bob", ChannelKind.LOCATION, "welcome", null, false);
        verify(template).convertAndSendToUser(eq("alice"), eq(StompConnectionSink.EVENTS_QUEUE),
                argThat((RealtimeEnvelope envelope) -> "welcome".equals(envelope.getPayload())), anyMap());
    }

    @Test
    void repeatedSubscribe_registersOnlyOnce() {
        manager.handleSessionConnect(connectEvent("ws-1"));
        manager.handleEventsSubscribed(subscribed("ws-1", "alice", "s1"));
        manager.handleEventsSubscribed(subscribed("ws-1", "alice", "s1"));

        assertEquals(1, kit.registry.connectionsFor("alice").size());
    }

    @Test
    void disconnect_unregistersConnection() {
        manager.handleSessionConnect(connectEvent("ws-1"));
        manager.handleEventsSubscribed(subscribed("ws-1", "alice", "s1"));

        manager.handleSessionDisconnect(disconnectEvent("ws-1"));
        manager.handleSessionDisconnect(disconnectEvent("ws-1"));

        assertTrue(kit.registry.connectionsFor("alice").isEmpty());
        assertEquals(Optional.empty(), manager.connectionIdOf("ws-1"));
        assertEquals(0, manager.activeSessionCount());
        assertTrue(kit.registry.isBrieflyReachable("alice"));
    }

    @Test
    void subscribeAfterDisconnect_isIgnored() {
        manager.handleSessionConnect(connectEvent("ws-1"));
        manager.handleSessionDisconnect(disconnectEvent("ws-1"));

        manager.handleEventsSubscribed(subscribed("ws-1", "alice", "s1"));

        assertFalse(kit.registry.isKnown("alice"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void rejectedSession_isKickedAndDisconnected() {
        RealtimeGateway strict = new RealtimeGateway(kit.registry, kit.dispatcher,
                identity -> Optional.of("s-current"), mock(ObjectProvider.class), kit.properties);
        WebSocketSessionManager strictManager = new WebSocketSessionManager(strict, template, disconnectHelper);

        strictManager.handleSessionConnect(connectEvent("ws-9"));
        strictManager.handleEventsSubscribed(subscribed("ws-9", "alice", "s-old"));

        verify(disconnectHelper).sendKickMessage(eq("alice"), eq("ws-9"), eq(CloseReason.SESSION_REPLACED), anyString());
        verify(disconnectHelper).forceDisconnect("ws-9");
        assertTrue(strictManager.connectionIdOf("ws-9").isEmpty());
    }

    @Test
    void newSessionOnAnotherSocket_kicksOldSocket() {
        manager.handleSessionConnect(connectEvent("ws-1"));
        manager.handleEventsSubscribed(subscribed("ws-1", "alice", "s1"));
        manager.handleSessionConnect(connectEvent("ws-2"));
        manager.handleEventsSubscribed(subscribed("ws-2", "alice", "s2"));

        verify(disconnectHelper).sendKickMessage(eq("alice"), eq("ws-1"), eq(CloseReason.SESSION_REPLACED), any());
        verify(disconnectHelper).forceDisconnect("ws-1");
        assertEquals(1, kit.registry.connectionsFor("alice").size());
        assertEquals("s2", kit.onlyConnection("alice").getSessionId());
    }

    @Test
    void touch_refreshesConnectionActivity() {
        manager.handleSessionConnect(connectEvent("ws-1"));
        manager.handleEventsSubscribed(subscribed("ws-1", "alice", "s1"));
        kit.clock.advance(java.time.Duration.ofMinutes(2));

        manager.touch("ws-1");
        manager.touch("unknown");
        manager.touch(null);

        assertEquals(0, kit.onlyConnection("alice").idleMillis(kit.clock.millis()));
    }

    private SessionConnectEvent connectEvent(String wsSessionId) {
        return new SessionConnectEvent(this, stompMessage(StompCommand.CONNECT, wsSessionId));
    }

    private SessionDisconnectEvent disconnectEvent(String wsSessionId) {
        return new SessionDisconnectEvent(this, stompMessage(StompCommand.DISCONNECT, wsSessionId),
                wsSessionId, CloseStatus.NORMAL);
    }

    private EventsSubscribedEvent subscribed(String wsSessionId, String identity, String gameSession) {
        return new EventsSubscribedEvent(this, wsSessionId, new StompPrincipal(identity, gameSession));
    }

    private static Message<byte[]> stompMessage(StompCommand command, String wsSessionId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        accessor.setSessionId(wsSessionId);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }
}
