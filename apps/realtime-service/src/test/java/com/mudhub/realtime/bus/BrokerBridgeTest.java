package com.mudhub.realtime.bus;

import com.alibaba.fastjson2.JSON;
import com.mudhub.realtime.RecordingSink;
import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.MessageKind;
import com.mudhub.session.model.RealtimeEnvelope;
import com.mudhub.session.model.TransportKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class BrokerBridgeTest {

    private static final Duration FLUSH = Duration.ofSeconds(2);

    private final SubjectNames subjects = new SubjectNames("chat");
    private InMemoryBrokerClient client;
    private BrokerBridge node1;
    private BrokerBridge node2;
    private final List<String> receivedBy1 = new CopyOnWriteArrayList<>();
    private final List<String> receivedBy2 = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        RealtimeProperties.Broker config = new RealtimeProperties.Broker();
        config.setRetryInitialDelay(Duration.ofMillis(10));
        config.setRetryMaxDelay(Duration.ofMillis(40));

        client = new InMemoryBrokerClient();
        node1 = new BrokerBridge(client, subjects, "node-1", config);
        node2 = new BrokerBridge(client, subjects, "node-2", config);
        node1.setInboundHandler((kind, param, envelope) -> receivedBy1.add(kind + ":" + param + ":" + envelope.getPayload()));
        node2.setInboundHandler((kind, param, envelope) -> receivedBy2.add(kind + ":" + param + ":" + envelope.getPayload()));
        node1.start();
        node2.start();
        assertTrue(node1.flush(FLUSH));
        assertTrue(node2.flush(FLUSH));
    }

    @AfterEach
    void tearDown() {
        node1.stop();
        node2.stop();
    }

    @Test
    void start_subscribesGlobalAndSystemSubjects() {
        assertEquals(2, client.subscriberCount("chat.global"));
        assertEquals(2, client.subscriberCount("chat.system"));
        assertEquals(1, node1.refCount("chat.global"));
        assertEquals(2, node1.stats().subscriptions());
    }

    @Test
    void publish_isRelayedToOtherInstanceAndEchoIsDropped() {
        node1.publish("chat.global", envelope("node-1", "hello world"));
        assertTrue(node1.flush(FLUSH));

        assertEquals(List.of("BROADCAST:null:hello world"), receivedBy2);
        assertTrue(receivedBy1.isEmpty());
        assertEquals(1, node1.stats().echoes());
        assertEquals(1, node1.stats().published());
        assertEquals(1, node2.stats().relayed());
    }

    @Test
    void locationSubjects_areReferenceCounted() {
        String tavern = subjects.location("tavern");
        node1.acquire(tavern);
        node1.acquire(tavern);
        assertTrue(node1.flush(FLUSH));
        assertEquals(2, node1.refCount(tavern));
        assertEquals(1, client.subscriberCount(tavern));

        node1.release(tavern);
        assertTrue(node1.flush(FLUSH));
        assertEquals(1, client.subscriberCount(tavern));

        node1.release(tavern);
        node1.release(tavern);
        assertTrue(node1.flush(FLUSH));
        assertEquals(0, node1.refCount(tavern));
        assertEquals(0, client.subscriberCount(tavern));
    }

    @Test
    void locationMessage_carriesLocationKeyFromSubject() {
        String tavern = subjects.location("tavern");
        node2.acquire(tavern);
        assertTrue(node2.flush(FLUSH));

        node1.publish(tavern, envelope("node-1", "cheers"));
        assertTrue(node1.flush(FLUSH));

        assertEquals(List.of("LOCATION:tavern:cheers"), receivedBy2);
    }

    @Test
    void unavailableBroker_entersDegradedModeAndRecovers() {
        client.setAvailable(false);
        node1.publish("chat.global", envelope("node-1", "delayed"));

        assertTrue(await(node1::isDegraded), "bridge should report degraded mode");
        assertTrue(receivedBy2.isEmpty());

        client.setAvailable(true);
        assertTrue(node1.flush(FLUSH));

        assertFalse(node1.isDegraded());
        assertEquals(List.of("BROADCAST:null:delayed"), receivedBy2);
        assertTrue(node1.stats().retries() >= 1);
    }

    @Test
    void fullPublishQueue_dropsPublishesButNeverSubscriptions() {
        RealtimeProperties.Broker config = new RealtimeProperties.Broker();
        config.setRetryInitialDelay(Duration.ofMillis(10));
        config.setRetryMaxDelay(Duration.ofMillis(40));
        config.setQueueCapacity(1);
        BrokerBridge small = new BrokerBridge(client, subjects, "node-3", config);
        String tavern = subjects.location("tavern");
        try {
            client.setAvailable(false);
            small.publish("chat.global", envelope("node-3", "first"));
            assertTrue(await(small::isDegraded));
            small.publish("chat.global", envelope("node-3", "second"));
            small.publish("chat.global", envelope("node-3", "third"));
            small.acquire(tavern);

            assertEquals(1, small.stats().dropped());

            client.setAvailable(true);
            assertTrue(small.flush(FLUSH));

            assertEquals(1, small.refCount(tavern));
            assertEquals(1, client.subscriberCount(tavern));
            assertEquals(List.of("BROADCAST:null:first", "BROADCAST:null:second"), receivedBy2);
        } finally {
            small.stop();
        }
    }

    @Test
    void directSubject_followsRegistryPresence() {
        ConnectionRegistry registry = new ConnectionRegistry(Duration.ofSeconds(60), Duration.ofHours(1),
                java.time.Clock.systemUTC());
        registry.addListener(node1);
        String aliceDirect = subjects.direct("alice");

        ConnectionInfo first = registry.register("alice", TransportKind.BIDIRECTIONAL_SOCKET, "s1", new RecordingSink());
        ConnectionInfo second = registry.register("alice", TransportKind.SERVER_PUSH_STREAM, "s1", new RecordingSink());
        assertTrue(node1.flush(FLUSH));
        assertEquals(1, node1.refCount(aliceDirect));
        assertEquals(1, client.subscriberCount(aliceDirect));

        registry.unregister(first.getConnectionId());
        assertEquals(1, node1.refCount(aliceDirect));

        registry.unregister(second.getConnectionId());
        assertTrue(node1.flush(FLUSH));
        assertEquals(0, node1.refCount(aliceDirect));
        assertEquals(0, client.subscriberCount(aliceDirect));
    }

    @Test
    void malformedOrUnknownMessages_areIgnored() {
        node2.onMessage("chat.global", "{not json");
        node2.onMessage("other.global", JSON.toJSONString(envelope("node-1", "x")));
        node2.onMessage("chat.location.a.b", JSON.toJSONString(envelope("node-1", "x")));

        assertTrue(receivedBy2.isEmpty());
        assertEquals(0, node2.stats().relayed());
    }

    @Test
    void inboundHandlerFailure_doesNotBreakBridge() {
        node2.setInboundHandler((kind, param, envelope) -> {
            throw new IllegalStateException("boom");
        });
        node1.publish("chat.system", envelope("node-1", "first"));
        assertTrue(node1.flush(FLUSH));

        node2.setInboundHandler((kind, param, envelope) -> receivedBy2.add(kind + ":" + envelope.getPayload()));
        node1.publish("chat.system", envelope("node-1", "second"));
        assertTrue(node1.flush(FLUSH));

        assertEquals(List.of(ChannelKind.SYSTEM + ":second"), receivedBy2);
    }

    private static RealtimeEnvelope envelope(String origin, String payload) {
        return RealtimeEnvelope.builder()
                .messageId("m-" + payload)
                .sequence(1)
                .kind(MessageKind.CHAT)
                .channel("broadcast")
                .senderId("alice")
                .payload(payload)
                .origin(origin)
                .build();
    }

    private static boolean await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return condition.getAsBoolean();
    }
}
