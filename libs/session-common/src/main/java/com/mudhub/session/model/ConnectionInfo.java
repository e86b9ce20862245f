package com.mudhub.session.model;

import com.mudhub.session.ConnectionSink;
import lombok.Getter;

import java.util.Objects;

/**
 * 一条活跃的传输连接。
 *
 * 只由 {@link com.mudhub.session.ConnectionRegistry} 创建与销毁；
 * connectionId 全局唯一，且只对应一个玩家、一个游戏会话。
 */
@Getter
public class ConnectionInfo {

    /** 连接 ID（注册表生成的 UUID） */
    private final String connectionId;

    /** 所属玩家 */
    private final String identity;

    /** 传输类型 */
    private final TransportKind transportKind;

    /** 建立连接时所在的游戏会话 */
    private final String sessionId;

    /** 建立时间（毫秒时间戳） */
    private final long establishedAt;

    /** 最近活动时间：入站帧或成功投递都会刷新 */
    private volatile long lastActivityAt;

    /** 投递失败后置为 false，等待清理任务回收 */
    private volatile boolean healthy = true;

    /** 传输层提供的发送/关闭句柄，不参与展示 */
    @Getter(lombok.AccessLevel.NONE)
    private final transient ConnectionSink sink;

    public ConnectionInfo(String connectionId, String identity, TransportKind transportKind,
                          String sessionId, long establishedAt, ConnectionSink sink) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.transportKind = Objects.requireNonNull(transportKind, "transportKind");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.establishedAt = establishedAt;
        this.lastActivityAt = establishedAt;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ConnectionSink sink() {
        return sink;
    }

    public void touch(long nowMillis) {
        if (nowMillis > lastActivityAt) {
            lastActivityAt = nowMillis;
        }
    }

    public void markUnhealthy() {
        this.healthy = false;
    }

    public long ageMillis(long nowMillis) {
        return Math.max(0, nowMillis - establishedAt);
    }

    public long idleMillis(long nowMillis) {
        return Math.max(0, nowMillis - lastActivityAt);
    }

    @Override
    public String toString() {
        return "ConnectionInfo{" + connectionId + ", identity=" + identity
                + ", transport=" + transportKind + ", session=" + sessionId + ", healthy=" + healthy + "}";
    }
}
