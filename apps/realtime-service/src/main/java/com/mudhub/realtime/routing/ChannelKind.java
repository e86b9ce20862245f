package com.mudhub.realtime.routing;

import java.util.Locale;

/**
 * 频道类型：决定收件人集合与限流额度。
 */
public enum ChannelKind {

    /** 同一位置（房间）内的玩家 */
    LOCATION,

    /** 全服广播（需满足资格） */
    BROADCAST,

    /** 私聊 */
    DIRECT,

    /** 系统消息：所有在线玩家，不受屏蔽影响 */
    SYSTEM;

    /** 频道名（小写，用于消息信封与 Broker 主题） */
    public String channelName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChannelKind fromChannelName(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be blank");
        }
        return ChannelKind.valueOf(channel.trim().toUpperCase(Locale.ROOT));
    }
}
