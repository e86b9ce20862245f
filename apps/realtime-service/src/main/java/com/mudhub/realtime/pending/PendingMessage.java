package com.mudhub.realtime.pending;

import com.mudhub.session.model.RealtimeEnvelope;

/**
 * 一条暂存消息：等待玩家重连后投递。
 */
public record PendingMessage(String identity, RealtimeEnvelope envelope, long enqueuedAt, long ttlMillis) {

    public boolean isExpired(long nowMillis) {
        return nowMillis - enqueuedAt >= ttlMillis;
    }
}
