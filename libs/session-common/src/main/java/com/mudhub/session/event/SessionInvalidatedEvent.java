package com.mudhub.session.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 会话失效事件（领域模型）。
 *
 * 说明：
 * - 放在 session-common 中，作为“会话领域”的通用事件结构；
 * - 传输方式（Kafka 等）由上层模块决定，本类与 Kafka 无关；
 * - 用于表达“某玩家的某个/所有游戏会话已经失效”，各实例收到后断开本地连接。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionInvalidatedEvent {

    /** 玩家标识 */
    private String identity;

    /**
     * 游戏会话 ID。
     *
     * 可选：提供时只断开属于该会话的连接；SESSION_REPLACED 事件中表示新会话。
     */
    private String sessionId;

    /** 事件类型 */
    private EventType eventType;

    /** 事件触发时间（时间戳） */
    private Long timestamp;

    /** 可选：触发原因描述 */
    private String reason;

    /** 产生事件的实例 ID，实例忽略自己发出的事件 */
    private String origin;

    /**
     * 事件类型枚举
     */
    public enum EventType {
        /** 同一玩家在别处开启了新会话 */
        SESSION_REPLACED,
        /** 玩家登出 */
        LOGOUT,
        /** 管理员强制下线 */
        FORCE_LOGOUT,
        /** 其他原因 */
        OTHER
    }

    /**
     * 创建事件实例（自动设置时间戳）
     */
    public static SessionInvalidatedEvent of(String identity, String sessionId, EventType eventType, String reason) {
        return new SessionInvalidatedEvent(identity, sessionId, eventType, Instant.now().toEpochMilli(), reason, null);
    }

    /**
     * 创建事件实例（无会话 ID、无原因）
     */
    public static SessionInvalidatedEvent of(String identity, EventType eventType) {
        return of(identity, null, eventType, null);
    }
}
