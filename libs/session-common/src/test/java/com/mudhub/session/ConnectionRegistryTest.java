package com.mudhub.session;

import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.IdentitySessionSnapshot;
import com.mudhub.session.model.PresenceStatus;
import com.mudhub.session.model.TransportKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRegistryTest {

    private MutableClock clock;
    private ConnectionRegistry registry;
    private List<String> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new ConnectionRegistry(Duration.ofSeconds(60), Duration.ofHours(1), clock);
        events = new ArrayList<>();
        registry.addListener(new RegistryListener() {
            @Override
            public void onConnectionOpened(ConnectionInfo connection) {
                events.add("opened:" + connection.getIdentity());
            }

            @Override
            public void onConnectionClosed(ConnectionInfo connection, CloseReason reason) {
                events.add("closed:" + connection.getIdentity() + ":" + reason);
            }

            @Override
            public void onPresenceChanged(PresenceTransition transition) {
                events.add(transition.getType() + ":" + transition.getIdentity());
            }
        });
    }

    @Test
    void register_firstConnectionAdoptsSessionAndEntersOnce() {
        ConnectionInfo first = registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        ConnectionInfo second = registry.register("alice", TransportKind.SERVER_PUSH_STREAM, "s1", new RecordingSink());

        assertNotEquals(first.getConnectionId(), second.getConnectionId());
        assertEquals(2, registry.connectionsFor("alice").size());
        assertEquals("s1", registry.currentSession("alice").orElseThrow());
        assertEquals(List.of("opened:alice", "ENTERED:alice", "opened:alice"), events);
        assertEquals(PresenceStatus.ONLINE, registry.presenceOf("alice").getStatus());
    }

    @Test
    void register_rejectsBlankAndMismatchedSession() {
        assertThrows(RejectedConnectionException.class,
                () -> registry.register(" ", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink()));
        assertThrows(RejectedConnectionException.class,
                () -> registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "", new RecordingSink()));

        registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        RejectedConnectionException ex = assertThrows(RejectedConnectionException.class,
                () -> registry.register("alice", TransportKind.SERVER_PUSH_STREAM, "s2", new RecordingSink()));
        assertEquals("s2", ex.getSessionId());
        assertEquals(1, registry.connectionsFor("alice").size());
    }

    @Test
    void unregister_isIdempotentAndLeavesOnLastConnection() {
        ConnectionInfo a = registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        ConnectionInfo b = registry.register("alice", TransportKind.SERVER_PUSH_STREAM, "s1", new RecordingSink());
        events.clear();

        assertTrue(registry.unregister(a.getConnectionId()));
        assertFalse(registry.unregister(a.getConnectionId()));
        assertEquals(List.of("closed:alice:CLIENT_CLOSED"), events);

        assertTrue(registry.unregister(b.getConnectionId()));
        assertEquals(List.of("closed:alice:CLIENT_CLOSED", "closed:alice:CLIENT_CLOSED", "LEFT:alice"), events);
        assertEquals(PresenceStatus.OFFLINE, registry.presenceOf("alice").getStatus());
        assertNotNull(registry.presenceOf("alice").getLastSeen());
        assertFalse(registry.unregister("no-such-connection"));
        assertFalse(registry.unregister(null));
    }

    @Test
    void startNewSession_closesOldConnectionsBeforeAdopting() {
        RecordingSink oldSocket = new RecordingSink();
        RecordingSink oldStream = new RecordingSink();
        ConnectionInfo c1 = registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", oldSocket);
        ConnectionInfo c2 = registry.register("alice", TransportKind.SERVER_PUSH_STREAM, "s1", oldStream);
        events.clear();

        List<String> evicted = registry.startNewSession("alice", "s2");

        assertEquals(List.of(c1.getConnectionId(), c2.getConnectionId()), evicted);
        assertEquals(CloseReason.SESSION_REPLACED, oldSocket.closedWith);
        assertEquals(CloseReason.SESSION_REPLACED, oldStream.closedWith);
        assertTrue(registry.connectionsFor("alice").isEmpty());
        assertEquals("s2", registry.currentSession("alice").orElseThrow());

        registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s2", new RecordingSink());
        long left = events.stream().filter("LEFT:alice"::equals).count();
        long entered = events.stream().filter("ENTERED:alice"::equals).count();
        assertEquals(1, left);
        assertEquals(1, entered);
        assertTrue(events.indexOf("LEFT:alice") < events.indexOf("ENTERED:alice"));
    }

    @Test
    void startNewSession_sameSessionIsNoop() {
        registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        assertTrue(registry.startNewSession("alice", "s1").isEmpty());
        assertEquals(1, registry.connectionsFor("alice").size());
    }

    @Test
    void atMostOneSessionUnderConcurrentLogins() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < 40; i++) {
            String session = "s" + (i % 4);
            pool.submit(() -> {
                start.await();
                registry.startNewSession("alice", session);
                try {
                    registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, session, new RecordingSink());
                } catch (RejectedConnectionException ignored) {
                    // 另一个线程抢先切换了会话
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        String current = registry.currentSession("alice").orElseThrow();
        for (ConnectionInfo info : registry.connectionsFor("alice")) {
            assertEquals(current, info.getSessionId());
        }
    }

    @Test
    void isBrieflyReachable_followsReconnectWindow() {
        ConnectionInfo c = registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        assertFalse(registry.isBrieflyReachable("alice"));

        registry.unregister(c.getConnectionId());
        assertTrue(registry.isBrieflyReachable("alice"));

        clock.advance(Duration.ofSeconds(61));
        assertFalse(registry.isBrieflyReachable("alice"));
        assertFalse(registry.isBrieflyReachable("nobody"));
    }

    @Test
    void markUnhealthy_hidesConnectionUntilEvicted() {
        RecordingSink sink = new RecordingSink();
        ConnectionInfo c = registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", sink);

        registry.markUnhealthy(c.getConnectionId());
        assertTrue(registry.connectionsFor("alice").isEmpty());
        assertEquals(1, registry.allConnections().size());

        assertTrue(registry.evict(c.getConnectionId(), CloseReason.UNHEALTHY));
        assertEquals(CloseReason.UNHEALTHY, sink.closedWith);
        assertEquals(0, registry.connectionCount());
    }

    @Test
    void forceDisconnect_endsSession() {
        RecordingSink sink = new RecordingSink();
        registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", sink);

        assertEquals(1, registry.forceDisconnect("alice", CloseReason.FORCED).size());
        assertEquals(CloseReason.FORCED, sink.closedWith);
        assertTrue(registry.currentSession("alice").isEmpty());
        assertTrue(registry.forceDisconnect("nobody", CloseReason.FORCED).isEmpty());

        // 会话已结束，任意新会话都可以直接登记
        registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s9", new RecordingSink());
        assertEquals("s9", registry.currentSession("alice").orElseThrow());
    }

    @Test
    void pruneIdleIdentities_removesOnlyOfflineEntriesPastRetention() {
        ConnectionInfo a = registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        registry.register("bob", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        registry.unregister(a.getConnectionId());

        assertTrue(registry.pruneIdleIdentities().isEmpty());
        clock.advance(Duration.ofHours(2));
        assertEquals(List.of("alice"), registry.pruneIdleIdentities());

        assertFalse(registry.isKnown("alice"));
        assertTrue(registry.isKnown("bob"));
        assertEquals(List.of("bob"), new ArrayList<>(registry.onlineIdentities()));

        // 回收后重新连接会得到新的条目
        registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s2", new RecordingSink());
        assertTrue(registry.isKnown("alice"));
    }

    @Test
    void snapshot_reportsConnectionsAndSession() {
        registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        registry.register("alice", TransportKind.SERVER_PUSH_STREAM, "s1", new RecordingSink());
        clock.advance(Duration.ofSeconds(30));

        IdentitySessionSnapshot snapshot = registry.snapshot("alice");

        assertEquals("s1", snapshot.getSessionId());
        assertEquals(2, snapshot.getConnections().size());
        assertEquals(1, snapshot.countByTransport(TransportKind.SERVER_PUSH_STREAM));
        assertEquals(30, snapshot.getConnections().get(0).getIdleSeconds());
        assertTrue(snapshot.getPresence().isOnline());
    }
}
