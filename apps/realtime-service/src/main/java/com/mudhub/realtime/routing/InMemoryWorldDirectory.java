package com.mudhub.realtime.routing;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内的位置表：identity -> locationKey，以及反向索引。
 *
 * 写入只通过位置同步路径（{@code LocationMembershipSync}）进行。
 */
@Slf4j
public class InMemoryWorldDirectory implements WorldDirectory {

    private final ConcurrentMap<String, String> locations = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> occupants = new ConcurrentHashMap<>();
    private final Map<ChannelKind, Set<String>> restricted = new EnumMap<>(ChannelKind.class);

    public InMemoryWorldDirectory() {
        for (ChannelKind kind : ChannelKind.values()) {
            restricted.put(kind, ConcurrentHashMap.newKeySet());
        }
    }

    @Override
    public Optional<String> currentLocation(String identity) {
        return identity == null ? Optional.empty() : Optional.ofNullable(locations.get(identity));
    }

    @Override
    public Set<String> identitiesAt(String locationKey) {
        Set<String> set = locationKey == null ? null : occupants.get(locationKey);
        return set == null ? Set.of() : Set.copyOf(set);
    }

    @Override
    public boolean meetsEligibility(String identity, ChannelKind kind) {
        return !restricted.get(kind).contains(identity);
    }

    /**
     * 把玩家移动到新位置。
     *
     * @return 之前所在的位置（可能为空）
     */
    public synchronized Optional<String> moveTo(String identity, String locationKey) {
        String previous = locations.put(identity, locationKey);
        if (previous != null && !previous.equals(locationKey)) {
            removeOccupant(previous, identity);
        }
        occupants.computeIfAbsent(locationKey, k -> ConcurrentHashMap.newKeySet()).add(identity);
        log.debug("位置更新: identity={}, from={}, to={}", identity, previous, locationKey);
        return Optional.ofNullable(previous);
    }

    /**
     * 玩家离开世界（不在任何位置）。
     */
    public synchronized Optional<String> remove(String identity) {
        String previous = locations.remove(identity);
        if (previous != null) {
            removeOccupant(previous, identity);
        }
        return Optional.ofNullable(previous);
    }

    /** 禁止玩家接收某频道（资格不足） */
    public void restrict(String identity, ChannelKind kind) {
        restricted.get(kind).add(identity);
    }

    public void lift(String identity, ChannelKind kind) {
        restricted.get(kind).remove(identity);
    }

    private void removeOccupant(String locationKey, String identity) {
        occupants.computeIfPresent(locationKey, (key, set) -> {
            set.remove(identity);
            return set.isEmpty() ? null : set;
        });
    }
}
