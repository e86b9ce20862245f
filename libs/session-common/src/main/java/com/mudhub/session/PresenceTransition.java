package com.mudhub.session;

import java.util.Objects;

/**
 * 在线状态切换事件（进入/离开）。
 *
 * 构造器与工厂方法都不对包外开放：只有 {@link ConnectionRegistry} 能产生该事件，
 * 位置同步等其他路径拿不到实例，也就无法重复广播上下线。
 */
public final class PresenceTransition {

    public enum Type {
        ENTERED,
        LEFT
    }

    private final Type type;
    private final String identity;
    private final String sessionId;
    private final String connectionId;
    private final long occurredAt;

    private PresenceTransition(Type type, String identity, String sessionId, String connectionId, long occurredAt) {
        this.type = type;
        this.identity = Objects.requireNonNull(identity, "identity");
        this.sessionId = sessionId;
        this.connectionId = connectionId;
        this.occurredAt = occurredAt;
    }

    static PresenceTransition entered(String identity, String sessionId, String connectionId, long at) {
        return new PresenceTransition(Type.ENTERED, identity, sessionId, connectionId, at);
    }

    static PresenceTransition left(String identity, String sessionId, String connectionId, long at) {
        return new PresenceTransition(Type.LEFT, identity, sessionId, connectionId, at);
    }

    public Type getType() {
        return type;
    }

    public String getIdentity() {
        return identity;
    }

    public String getSessionId() {
        return sessionId;
    }

    /** 触发该切换的连接（ENTERED 为新连接，LEFT 为最后一个被移除的连接） */
    public String getConnectionId() {
        return connectionId;
    }

    public long getOccurredAt() {
        return occurredAt;
    }

    public boolean isEntered() {
        return type == Type.ENTERED;
    }

    @Override
    public String toString() {
        return "PresenceTransition{" + type + ", identity=" + identity + ", session=" + sessionId + "}";
    }
}
