package com.mudhub.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单条连接的只读快照，供运维接口展示（年龄、空闲时间、健康状态等）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionSnapshot {

    private String connectionId;

    private String identity;

    private TransportKind transportKind;

    private String sessionId;

    /** 建立时间（毫秒时间戳） */
    private long establishedAt;

    /** 最近活动时间（毫秒时间戳） */
    private long lastActivityAt;

    private long ageSeconds;

    private long idleSeconds;

    private boolean healthy;

    public static ConnectionSnapshot of(ConnectionInfo info, long nowMillis) {
        return ConnectionSnapshot.builder()
                .connectionId(info.getConnectionId())
                .identity(info.getIdentity())
                .transportKind(info.getTransportKind())
                .sessionId(info.getSessionId())
                .establishedAt(info.getEstablishedAt())
                .lastActivityAt(info.getLastActivityAt())
                .ageSeconds(info.ageMillis(nowMillis) / 1000)
                .idleSeconds(info.idleMillis(nowMillis) / 1000)
                .healthy(info.isHealthy())
                .build();
    }

    public String getEstablishedAtIso() {
        return Instant.ofEpochMilli(establishedAt).toString();
    }
}
