package com.mudhub.realtime.routing;

import com.mudhub.realtime.bus.SubjectNames;
import com.mudhub.session.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 频道路由：根据频道类型计算收件人集合与 Broker 主题。
 *
 * 路由只回答“发给谁”，不做发送者排除、屏蔽过滤和限流。
 */
@Slf4j
public class ChannelRouter {

    private final ConnectionRegistry registry;
    private final WorldDirectory world;
    private final SubjectNames subjects;

    /** 收件人 -> 最近一次给他发私聊的人（用于 reply） */
    private final ConcurrentMap<String, String> lastDirectSender = new ConcurrentHashMap<>();

    public ChannelRouter(ConnectionRegistry registry, WorldDirectory world, SubjectNames subjects) {
        this.registry = registry;
        this.world = world;
        this.subjects = subjects;
    }

    /**
     * 为本地发起的消息路由。
     *
     * @param target 私聊目标，其他频道忽略
     */
    public RouteResult route(ChannelKind kind, String sender, String target) {
        return switch (kind) {
            case LOCATION -> routeLocation(world.currentLocation(sender).orElse(null));
            case BROADCAST -> RouteResult.matched(kind, eligibleOnline(), subjects.global(), null);
            case DIRECT -> routeDirect(sender, target);
            case SYSTEM -> RouteResult.matched(kind, registry.onlineIdentities(), subjects.system(), null);
        };
    }

    /**
     * 为 Broker 转发进来的消息路由：位置 key / 私聊收件人取自主题参数。
     */
    public RouteResult routeInbound(ChannelKind kind, String subjectParam, String sender) {
        return switch (kind) {
            case LOCATION -> routeLocation(subjectParam);
            case DIRECT -> {
                if (subjectParam == null || !isKnown(subjectParam)) {
                    yield RouteResult.unmatched(kind);
                }
                yield RouteResult.matched(kind, Set.of(subjectParam), subjects.direct(subjectParam), null);
            }
            case BROADCAST, SYSTEM -> route(kind, sender, null);
        };
    }

    /**
     * 上下线通知的收件人：与 subject 同一位置的玩家（包含 subject 本人，由分发器排除）。
     */
    public RouteResult routePresence(String subjectIdentity) {
        return routeLocation(world.currentLocation(subjectIdentity).orElse(null));
    }

    /**
     * 记录一次已实际投递的私聊，供收件人 reply。被屏蔽的私聊不应调用。
     */
    public void recordDirect(String recipient, String sender) {
        if (recipient != null && sender != null && !sender.equals(recipient)) {
            lastDirectSender.put(recipient, sender);
        }
    }

    /** 发送者能否使用该频道，目前只有广播频道有门槛 */
    public boolean isEligible(String identity, ChannelKind kind) {
        return kind != ChannelKind.BROADCAST || world.meetsEligibility(identity, kind);
    }

    /** 最近给 identity 发私聊的人 */
    public Optional<String> replyTarget(String identity) {
        return Optional.ofNullable(lastDirectSender.get(identity));
    }

    /** 玩家条目被回收时清掉 reply 记录 */
    public void forget(String identity) {
        lastDirectSender.remove(identity);
    }

    /** 私聊目标是否存在：注册表认识，或者世界里能查到位置 */
    public boolean isKnown(String identity) {
        return registry.isKnown(identity) || world.currentLocation(identity).isPresent();
    }

    private RouteResult routeLocation(String locationKey) {
        if (locationKey == null) {
            return RouteResult.matched(ChannelKind.LOCATION, Set.of(), null, null);
        }
        String subject = subjects.isValidToken(locationKey) ? subjects.location(locationKey) : null;
        if (subject == null) {
            log.warn("位置 key 不能作为主题参数，仅本地投递: locationKey={}", locationKey);
        }
        return RouteResult.matched(ChannelKind.LOCATION, world.identitiesAt(locationKey), subject, locationKey);
    }

    private RouteResult routeDirect(String sender, String target) {
        if (target == null || target.isBlank() || !isKnown(target)) {
            return RouteResult.unmatched(ChannelKind.DIRECT);
        }
        String subject = subjects.isValidToken(target) ? subjects.direct(target) : null;
        return RouteResult.matched(ChannelKind.DIRECT, Set.of(target), subject, null);
    }

    private Set<String> eligibleOnline() {
        Set<String> eligible = new LinkedHashSet<>();
        for (String identity : registry.onlineIdentities()) {
            if (isEligible(identity, ChannelKind.BROADCAST)) {
                eligible.add(identity);
            }
        }
        return eligible;
    }
}
