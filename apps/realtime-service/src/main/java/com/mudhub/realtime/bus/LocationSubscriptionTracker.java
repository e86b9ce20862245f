package com.mudhub.realtime.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 每个玩家的位置主题订阅状态机：UNSUBSCRIBED 或 SUBSCRIBED(locationKey)。
 *
 * 切换位置时先释放旧主题再获取新主题，任何时刻一个玩家最多只持有一个位置订阅。
 * 状态迁移在 {@link ConcurrentMap#compute} 内完成，同一玩家的迁移互斥。
 */
@Slf4j
public class LocationSubscriptionTracker {

    public enum Status {
        UNSUBSCRIBED,
        SUBSCRIBED
    }

    /**
     * 某玩家的订阅状态。
     */
    public record State(Status status, String locationKey) {

        public static final State UNSUBSCRIBED = new State(Status.UNSUBSCRIBED, null);

        public static State subscribed(String locationKey) {
            return new State(Status.SUBSCRIBED, locationKey);
        }
    }

    private final ConcurrentMap<String, String> subscribed = new ConcurrentHashMap<>();
    private final BrokerBridge bridge;
    private final SubjectNames subjects;

    public LocationSubscriptionTracker(BrokerBridge bridge, SubjectNames subjects) {
        this.bridge = bridge;
        this.subjects = subjects;
    }

    /**
     * 迁移到 SUBSCRIBED(locationKey)；locationKey 为 null 时迁移到 UNSUBSCRIBED。
     */
    public State track(String identity, String locationKey) {
        String target = locationKey != null && subjects.isValidToken(locationKey) ? locationKey : null;
        if (locationKey != null && target == null) {
            log.warn("位置 key 不能作为主题参数，不订阅: identity={}, locationKey={}", identity, locationKey);
        }
        String result = subscribed.compute(identity, (id, current) -> {
            if (current != null && current.equals(target)) {
                return current;
            }
            if (current != null) {
                bridge.release(subjects.location(current));
            }
            if (target != null) {
                bridge.acquire(subjects.location(target));
            }
            return target;
        });
        return result == null ? State.UNSUBSCRIBED : State.subscribed(result);
    }

    /** 迁移到 UNSUBSCRIBED。 */
    public State clear(String identity) {
        return track(identity, null);
    }

    public State stateOf(String identity) {
        String key = subscribed.get(identity);
        return key == null ? State.UNSUBSCRIBED : State.subscribed(key);
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(subscribed);
    }
}
