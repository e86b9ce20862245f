package com.mudhub.realtime.gateway;

import com.mudhub.realtime.RealtimeTestKit;
import com.mudhub.realtime.RecordingSink;
import com.mudhub.session.event.SessionInvalidatedEvent;
import com.mudhub.session.event.SessionInvalidatedEvent.EventType;
import com.mudhub.session.model.CloseReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionInvalidatedListenerTest {

    private final RealtimeTestKit kit = new RealtimeTestKit();
    private final SessionInvalidatedListener listener = new SessionInvalidatedListener(kit.registry, kit.properties);

    @AfterEach
    void tearDown() {
        kit.close();
    }

    @Test
    void sessionReplacedElsewhere_closesLocalConnectionsOfOldSession() {
        RecordingSink sink = kit.join("alice", "tavern", "s1");

        listener.onSessionInvalidated(remote("alice", "s2", EventType.SESSION_REPLACED));

        assertEquals(CloseReason.SESSION_REPLACED, sink.closedWith);
        assertEquals(Optional.of("s2"), kit.registry.currentSession("alice"));
        assertNotNull(kit.connect("alice", "s2"));
    }

    @Test
    void forceLogout_endsSessionEverywhere() {
        RecordingSink sink = kit.join("alice", "tavern", "s1");

        listener.onSessionInvalidated(remote("alice", null, EventType.FORCE_LOGOUT));

        assertEquals(CloseReason.FORCED, sink.closedWith);
        assertTrue(kit.registry.currentSession("alice").isEmpty());
    }

    @Test
    void replacedWithoutSessionId_fallsBackToForceDisconnect() {
        RecordingSink sink = kit.join("alice", "tavern", "s1");

        listener.onSessionInvalidated(remote("alice", " ", EventType.SESSION_REPLACED));

        assertEquals(CloseReason.FORCED, sink.closedWith);
    }

    @Test
    void ownEvents_areIgnored() {
        RecordingSink sink = kit.join("alice", "tavern", "s1");
        SessionInvalidatedEvent own = SessionInvalidatedEvent.of("alice", "s2", EventType.SESSION_REPLACED, null);
        own.setOrigin("node-1");

        listener.onSessionInvalidated(own);

        assertNull(sink.closedWith);
        assertEquals(Optional.of("s1"), kit.registry.currentSession("alice"));
    }

    @Test
    void unknownIdentities_doNotCreateEntries() {
        listener.onSessionInvalidated(remote("stranger", "s9", EventType.SESSION_REPLACED));
        listener.onSessionInvalidated(remote("stranger", null, EventType.LOGOUT));

        assertFalse(kit.registry.isKnown("stranger"));
        assertEquals(0, kit.registry.identityCount());
    }

    private static SessionInvalidatedEvent remote(String identity, String sessionId, EventType type) {
        SessionInvalidatedEvent event = SessionInvalidatedEvent.of(identity, sessionId, type, null);
        event.setOrigin("node-2");
        return event;
    }
}
