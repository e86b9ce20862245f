package com.mudhub.realtime.bus;

import com.mudhub.realtime.routing.InMemoryWorldDirectory;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.PresenceTransition;
import com.mudhub.session.RegistryListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 位置同步路径：更新位置成员关系与位置主题订阅。
 *
 * 这里只改成员关系，不持有分发器，也拿不到 {@link PresenceTransition} 的构造入口，
 * 因此无论同步多少次都不会产生上下线广播；上下线只由注册表发出。
 */
@Slf4j
@RequiredArgsConstructor
public class LocationMembershipSync implements RegistryListener {

    private final InMemoryWorldDirectory world;
    private final LocationSubscriptionTracker tracker;
    private final ConnectionRegistry registry;

    /**
     * 玩家移动到新位置（游戏逻辑或世界同步调用）。
     *
     * @return 之前的位置
     */
    public Optional<String> updateLocation(String identity, String locationKey) {
        if (identity == null || identity.isBlank() || locationKey == null || locationKey.isBlank()) {
            throw new IllegalArgumentException("identity and locationKey must not be blank");
        }
        Optional<String> previous = world.moveTo(identity, locationKey);
        if (registry.presenceOf(identity).isOnline()) {
            tracker.track(identity, locationKey);
        }
        return previous;
    }

    /** 玩家离开世界。 */
    public Optional<String> removeFromWorld(String identity) {
        Optional<String> previous = world.remove(identity);
        tracker.clear(identity);
        return previous;
    }

    /**
     * 释放已离线玩家残留的位置订阅（位置更新与下线并发时可能出现）。
     *
     * @return 释放的订阅数
     */
    public int reconcile() {
        int released = 0;
        for (String identity : tracker.snapshot().keySet()) {
            if (!registry.presenceOf(identity).isOnline()) {
                tracker.clear(identity);
                released++;
            }
        }
        return released;
    }

    /**
     * 在线状态变化只影响位置主题订阅：上线订阅当前位置，下线释放。
     */
    @Override
    public void onPresenceChanged(PresenceTransition transition) {
        String identity = transition.getIdentity();
        if (transition.isEntered()) {
            tracker.track(identity, world.currentLocation(identity).orElse(null));
        } else {
            tracker.clear(identity);
        }
    }
}
