package com.mudhub.realtime.gateway;

import com.mudhub.realtime.RealtimeTestKit;
import com.mudhub.realtime.RecordingSink;
import com.mudhub.realtime.dispatch.SendResult;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.session.RejectedConnectionException;
import com.mudhub.session.event.SessionInvalidatedEvent;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.TransportKind;
import com.mudhub.sessionkafkanotifier.publisher.SessionEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealtimeGatewayTest {

    @Mock
    private ObjectProvider<SessionEventPublisher> publisherProvider;

    @Mock
    private SessionEventPublisher publisher;

    private RealtimeTestKit kit;
    private RealtimeGateway gateway;

    @BeforeEach
    void setUp() {
        kit = new RealtimeTestKit();
        gateway = new RealtimeGateway(kit.registry, kit.dispatcher, SessionAuthority.newestWins(),
                publisherProvider, kit.properties);
    }

    @AfterEach
    void tearDown() {
        kit.close();
    }

    @Test
    void acceptConnection_withNewSessionReplacesOldOneAndNotifiesOtherInstances() {
        when(publisherProvider.getIfAvailable()).thenReturn(publisher);
        RecordingSink oldSink = new RecordingSink();
        gateway.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", oldSink);

        ConnectionInfo fresh = gateway.acceptConnection("alice", TransportKind.SERVER_PUSH_STREAM, "s2", new RecordingSink());

        assertEquals(CloseReason.SESSION_REPLACED, oldSink.closedWith);
        assertEquals("s2", fresh.getSessionId());
        assertEquals(Optional.of("s2"), kit.registry.currentSession("alice"));
        assertEquals(1, kit.registry.connectionsFor("alice").size());

        ArgumentCaptor<SessionInvalidatedEvent> captor = ArgumentCaptor.forClass(SessionInvalidatedEvent.class);
        verify(publisher).publishSessionInvalidated(captor.capture());
        SessionInvalidatedEvent event = captor.getValue();
        assertEquals("alice", event.getIdentity());
        assertEquals("s2", event.getSessionId());
        assertEquals(SessionInvalidatedEvent.EventType.SESSION_REPLACED, event.getEventType());
        assertEquals("node-1", event.getOrigin());
    }

    @Test
    void acceptConnection_sameSessionAddsConnectionWithoutNotification() {
        gateway.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        gateway.acceptConnection("alice", TransportKind.SERVER_PUSH_STREAM, "s1", new RecordingSink());

        assertEquals(2, kit.registry.connectionsFor("alice").size());
        verifyNoInteractions(publisherProvider);
    }

    @Test
    void acceptConnection_rejectsSessionTheAuthorityNoLongerRecognises() {
        RealtimeGateway strict = new RealtimeGateway(kit.registry, kit.dispatcher,
                identity -> Optional.of("s-current"), publisherProvider, kit.properties);

        assertThrows(RejectedConnectionException.class,
                () -> strict.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s-stale", new RecordingSink()));
        assertFalse(kit.registry.isKnown("alice"));

        ConnectionInfo accepted = strict.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s-current", new RecordingSink());
        assertEquals("s-current", accepted.getSessionId());
    }

    @Test
    void acceptConnection_rejectsBlankIdentityOrSession() {
        assertThrows(RejectedConnectionException.class,
                () -> gateway.acceptConnection(" ", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink()));
        assertThrows(RejectedConnectionException.class,
                () -> gateway.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, null, new RecordingSink()));
    }

    @Test
    void disconnect_closesConnectionsAndPublishesForceLogout() {
        when(publisherProvider.getIfAvailable()).thenReturn(publisher);
        RecordingSink sink = new RecordingSink();
        gateway.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", sink);

        List<String> closed = gateway.disconnect("alice", "cheating");

        assertEquals(1, closed.size());
        assertEquals(CloseReason.FORCED, sink.closedWith);
        assertTrue(kit.registry.currentSession("alice").isEmpty());
        verify(publisher).publishSessionInvalidated(argThat(event ->
                event.getEventType() == SessionInvalidatedEvent.EventType.FORCE_LOGOUT
                        && "cheating".equals(event.getReason())));
    }

    @Test
    void notifications_areSkippedWhenKafkaIsNotConfigured() {
        when(publisherProvider.getIfAvailable()).thenReturn(null);
        gateway.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());

        assertDoesNotThrow(() -> gateway.acceptConnection("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s2", new RecordingSink()));
        assertDoesNotThrow(() -> gateway.disconnect("alice", "bye"));
        verify(publisher, never()).publishSessionInvalidated(any(SessionInvalidatedEvent.class));
    }

    @Test
    void send_validatesChannelAndTarget() {
        assertThrows(IllegalArgumentException.class,
                () -> gateway.send("alice", ChannelKind.SYSTEM, "hi", null));
        assertThrows(IllegalArgumentException.class,
                () -> gateway.send("alice", ChannelKind.DIRECT, "hi", " "));
        assertThrows(IllegalArgumentException.class,
                () -> gateway.send("alice", ChannelKind.LOCATION, "   ", null));
        assertThrows(IllegalArgumentException.class,
                () -> gateway.sendSystem(null));
    }

    @Test
    void send_trimsAndTruncatesLongMessages() {
        kit.properties.setMaxMessageLength(10);
        kit.join("alice", "tavern", "s-alice");
        RecordingSink bob = kit.join("bob", "tavern", "s-bob");

        SendResult result = gateway.send("alice", ChannelKind.LOCATION, "   abcdefghijklmnop  ", null);

        assertTrue(result.isDelivered());
        assertEquals(List.of("abcdefghij"), bob.chatPayloads());
    }

    @Test
    void send_truncatesOnCodePointBoundary() {
        kit.properties.setMaxMessageLength(3);
        kit.join("alice", "tavern", "s-alice");
        RecordingSink bob = kit.join("bob", "tavern", "s-bob");

        gateway.send("alice", ChannelKind.LOCATION, "ab\uD83D\uDE00cd", null);

        assertEquals(List.of("ab\uD83D\uDE00"), bob.chatPayloads());
    }
}
