package com.mudhub.realtime.routing;

import java.util.Set;

/**
 * 路由结果。
 *
 * @param matched     目标是否存在（私聊目标未知时为 false，不抛异常）
 * @param recipients  收件人集合（尚未排除发送者、尚未做屏蔽过滤）
 * @param subject     对应的 Broker 主题，无法确定时为 null
 * @param locationKey 位置频道的位置 key
 */
public record RouteResult(ChannelKind kind,
                          boolean matched,
                          Set<String> recipients,
                          String subject,
                          String locationKey) {

    public static RouteResult matched(ChannelKind kind, Set<String> recipients, String subject, String locationKey) {
        return new RouteResult(kind, true, Set.copyOf(recipients), subject, locationKey);
    }

    public static RouteResult unmatched(ChannelKind kind) {
        return new RouteResult(kind, false, Set.of(), null, null);
    }
}
