package com.mudhub.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 玩家在线状态视图：由注册表按需计算。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresenceView {

    /** 玩家标识 */
    private String identity;

    /** ONLINE 当且仅当存在至少一个连接 */
    private PresenceStatus status;

    /** 最近一次失去最后一个连接的时间（毫秒时间戳），从未断开过则为 null */
    private Long lastSeen;

    /** 当前连接数 */
    private int connectionCount;

    public boolean isOnline() {
        return status == PresenceStatus.ONLINE;
    }

    /**
     * 以 ISO-8601 字符串返回 lastSeen，便于展示。
     */
    public String getLastSeenIso() {
        if (lastSeen == null) {
            return "";
        }
        return Instant.ofEpochMilli(lastSeen).toString();
    }
}
