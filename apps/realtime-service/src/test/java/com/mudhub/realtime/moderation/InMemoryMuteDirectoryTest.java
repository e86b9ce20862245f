package com.mudhub.realtime.moderation;

import com.mudhub.realtime.routing.ChannelKind;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMuteDirectoryTest {

    private final InMemoryMuteDirectory mutes = new InMemoryMuteDirectory();

    @Test
    void mutedSender_isMutedOnEveryPlayerChannel() {
        assertTrue(mutes.mute("bob", "alice"));
        assertFalse(mutes.mute("bob", "alice"));

        assertTrue(mutes.isMuted("bob", "alice", ChannelKind.LOCATION));
        assertTrue(mutes.isMuted("bob", "alice", ChannelKind.DIRECT));
        assertFalse(mutes.isMuted("alice", "bob", ChannelKind.DIRECT));
        assertEquals(Set.of("alice"), mutes.mutedSendersOf("bob"));
    }

    @Test
    void systemChannel_cannotBeMuted() {
        mutes.mute("bob", "alice");

        assertFalse(mutes.isMuted("bob", "alice", ChannelKind.SYSTEM));
        assertThrows(IllegalArgumentException.class, () -> mutes.muteChannel("bob", ChannelKind.SYSTEM));
    }

    @Test
    void channelMute_silencesEverySenderOnThatChannel() {
        mutes.muteChannel("bob", ChannelKind.BROADCAST);

        assertTrue(mutes.isMuted("bob", "anyone", ChannelKind.BROADCAST));
        assertFalse(mutes.isMuted("bob", "anyone", ChannelKind.LOCATION));

        assertTrue(mutes.unmuteChannel("bob", ChannelKind.BROADCAST));
        assertFalse(mutes.isMuted("bob", "anyone", ChannelKind.BROADCAST));
    }

    @Test
    void unmute_andSelfMute() {
        mutes.mute("bob", "alice");
        assertTrue(mutes.unmute("bob", "alice"));
        assertFalse(mutes.unmute("bob", "alice"));
        assertFalse(mutes.isMuted("bob", "alice", ChannelKind.DIRECT));
        assertThrows(IllegalArgumentException.class, () -> mutes.mute("bob", "bob"));
    }
}
