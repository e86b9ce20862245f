package com.mudhub.realtime.routing;

import com.mudhub.realtime.MutableClock;
import com.mudhub.realtime.RecordingSink;
import com.mudhub.realtime.bus.SubjectNames;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.model.TransportKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChannelRouterTest {

    private ConnectionRegistry registry;
    private InMemoryWorldDirectory world;
    private ChannelRouter router;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new ConnectionRegistry(Duration.ofSeconds(60), Duration.ofHours(1), clock);
        world = new InMemoryWorldDirectory();
        router = new ChannelRouter(registry, world, new SubjectNames("chat"));
    }

    private void online(String identity) {
        registry.register(identity, TransportKind.BIDIRECTIONAL_SOCKET, "s-" + identity, new RecordingSink());
    }

    @Test
    void location_routesToEveryoneAtSendersLocation() {
        world.moveTo("alice", "tavern");
        world.moveTo("bob", "tavern");
        world.moveTo("carol", "forest");

        RouteResult route = router.route(ChannelKind.LOCATION, "alice", null);

        assertTrue(route.matched());
        assertEquals(Set.of("alice", "bob"), route.recipients());
        assertEquals("chat.location.tavern", route.subject());
        assertEquals("tavern", route.locationKey());
    }

    @Test
    void location_withoutLocationHasNoRecipients() {
        RouteResult route = router.route(ChannelKind.LOCATION, "alice", null);

        assertTrue(route.matched());
        assertTrue(route.recipients().isEmpty());
        assertNull(route.subject());
    }

    @Test
    void location_withUnsafeKeyIsDeliveredLocallyOnly() {
        world.moveTo("alice", "the tavern");
        world.moveTo("bob", "the tavern");

        RouteResult route = router.route(ChannelKind.LOCATION, "alice", null);

        assertEquals(Set.of("alice", "bob"), route.recipients());
        assertNull(route.subject());
    }

    @Test
    void broadcast_includesOnlyEligibleOnlineIdentities() {
        online("alice");
        online("bob");
        online("carol");
        world.restrict("carol", ChannelKind.BROADCAST);
        world.moveTo("dave", "tavern");

        RouteResult route = router.route(ChannelKind.BROADCAST, "alice", null);

        assertEquals(Set.of("alice", "bob"), route.recipients());
        assertEquals("chat.global", route.subject());

        world.lift("carol", ChannelKind.BROADCAST);
        assertTrue(router.route(ChannelKind.BROADCAST, "alice", null).recipients().contains("carol"));
    }

    @Test
    void direct_unknownTargetIsUnmatched() {
        RouteResult route = router.route(ChannelKind.DIRECT, "alice", "ghost");

        assertFalse(route.matched());
        assertTrue(route.recipients().isEmpty());
        assertTrue(router.replyTarget("ghost").isEmpty());
    }

    @Test
    void direct_routingDoesNotRecordReplyTarget() {
        online("bob");

        RouteResult route = router.route(ChannelKind.DIRECT, "alice", "bob");

        assertTrue(route.matched());
        assertEquals(Set.of("bob"), route.recipients());
        assertEquals("chat.direct.bob", route.subject());
        assertTrue(router.replyTarget("bob").isEmpty());

        router.recordDirect("bob", "alice");
        router.recordDirect("bob", "bob");
        assertEquals("alice", router.replyTarget("bob").orElseThrow());

        router.forget("bob");
        assertTrue(router.replyTarget("bob").isEmpty());
    }

    @Test
    void direct_targetKnownOnlyToWorldIsMatched() {
        world.moveTo("bob", "tavern");

        assertTrue(router.route(ChannelKind.DIRECT, "alice", "bob").matched());
    }

    @Test
    void system_routesToAllOnlineIdentities() {
        online("alice");
        online("bob");
        world.moveTo("carol", "tavern");

        RouteResult route = router.route(ChannelKind.SYSTEM, null, null);

        assertEquals(Set.of("alice", "bob"), route.recipients());
        assertEquals("chat.system", route.subject());
    }

    @Test
    void inbound_usesSubjectParameter() {
        world.moveTo("bob", "forest");
        online("carol");

        assertEquals(Set.of("bob"), router.routeInbound(ChannelKind.LOCATION, "forest", "zed").recipients());
        assertFalse(router.routeInbound(ChannelKind.DIRECT, "nobody", "zed").matched());

        RouteResult direct = router.routeInbound(ChannelKind.DIRECT, "carol", "zed");
        assertEquals(Set.of("carol"), direct.recipients());
        assertTrue(router.replyTarget("carol").isEmpty());
    }

    @Test
    void presence_routesToSubjectsLocation() {
        world.moveTo("alice", "tavern");
        world.moveTo("bob", "tavern");

        assertEquals(Set.of("alice", "bob"), router.routePresence("alice").recipients());
        assertTrue(router.routePresence("nobody").recipients().isEmpty());
    }
}
