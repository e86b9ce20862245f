package com.mudhub.realtime.moderation;

import com.mudhub.realtime.routing.ChannelKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内屏蔽表：玩家级屏蔽（屏蔽某人）+ 频道级屏蔽（屏蔽某频道）。
 */
@Slf4j
public class InMemoryMuteDirectory implements MuteDirectory {

    private final ConcurrentMap<String, Set<String>> mutedSenders = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<ChannelKind>> mutedChannels = new ConcurrentHashMap<>();

    @Override
    public boolean isMuted(String recipient, String sender, ChannelKind kind) {
        if (kind == ChannelKind.SYSTEM) {
            return false;
        }
        Set<ChannelKind> channels = mutedChannels.get(recipient);
        if (channels != null && channels.contains(kind)) {
            return true;
        }
        Set<String> senders = mutedSenders.get(recipient);
        return sender != null && senders != null && senders.contains(sender);
    }

    public boolean mute(String recipient, String sender) {
        if (recipient.equals(sender)) {
            throw new IllegalArgumentException("cannot mute yourself");
        }
        boolean added = mutedSenders.computeIfAbsent(recipient, k -> ConcurrentHashMap.newKeySet()).add(sender);
        log.info("玩家屏蔽: recipient={}, sender={}", recipient, sender);
        return added;
    }

    public boolean unmute(String recipient, String sender) {
        Set<String> senders = mutedSenders.get(recipient);
        return senders != null && senders.remove(sender);
    }

    public boolean muteChannel(String recipient, ChannelKind kind) {
        if (kind == ChannelKind.SYSTEM) {
            throw new IllegalArgumentException("System channel cannot be muted");
        }
        return mutedChannels.computeIfAbsent(recipient, k -> ConcurrentHashMap.newKeySet()).add(kind);
    }

    public boolean unmuteChannel(String recipient, ChannelKind kind) {
        Set<ChannelKind> channels = mutedChannels.get(recipient);
        return channels != null && channels.remove(kind);
    }

    public Set<String> mutedSendersOf(String recipient) {
        Set<String> senders = mutedSenders.get(recipient);
        return senders == null ? Set.of() : Set.copyOf(senders);
    }

    public Set<ChannelKind> mutedChannelsOf(String recipient) {
        Set<ChannelKind> channels = mutedChannels.get(recipient);
        return channels == null ? Set.of() : Set.copyOf(channels);
    }
}
