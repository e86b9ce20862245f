package com.mudhub.realtime.routing;

import java.util.Optional;
import java.util.Set;

/**
 * 世界/位置查询（由游戏世界模块提供）。
 *
 * 每次路由都实时查询，不在路由器里缓存位置。
 */
public interface WorldDirectory {

    /** 玩家当前所在位置 key，不在任何位置时为空 */
    Optional<String> currentLocation(String identity);

    /** 某位置上的全部玩家 */
    Set<String> identitiesAt(String locationKey);

    /** 玩家是否有资格接收该频道的消息（例如全服频道的等级限制） */
    default boolean meetsEligibility(String identity, ChannelKind kind) {
        return true;
    }
}
