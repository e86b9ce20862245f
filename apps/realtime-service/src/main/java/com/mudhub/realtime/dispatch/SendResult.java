package com.mudhub.realtime.dispatch;

import com.mudhub.realtime.ratelimit.RateLimitInfo;
import com.mudhub.realtime.routing.ChannelKind;

/**
 * 一次发送的内部结果（包含投递统计，只在服务端使用）。
 *
 * @param liveRecipients    实时投递成功的玩家数
 * @param pendingRecipients 进入暂存缓冲的玩家数
 * @param dropped           既不在线也不在重连窗口内、被丢弃的玩家数
 * @param rateLimit         被限流时的限流状态，其余情况为 null
 */
public record SendResult(SendOutcome outcome,
                         ChannelKind kind,
                         String messageId,
                         long sequence,
                         int liveRecipients,
                         int pendingRecipients,
                         int dropped,
                         RateLimitInfo rateLimit) {

    public static SendResult delivered(ChannelKind kind, String messageId, long sequence, DeliveryStats stats) {
        return new SendResult(SendOutcome.DELIVERED, kind, messageId, sequence,
                stats.live(), stats.pending(), stats.dropped(), null);
    }

    public static SendResult rateLimited(ChannelKind kind, RateLimitInfo info) {
        return new SendResult(SendOutcome.RATE_LIMITED, kind, null, 0, 0, 0, 0, info);
    }

    public static SendResult noSuchTarget(ChannelKind kind) {
        return new SendResult(SendOutcome.NO_SUCH_TARGET, kind, null, 0, 0, 0, 0, null);
    }

    public static SendResult muted(ChannelKind kind) {
        return new SendResult(SendOutcome.MUTED, kind, null, 0, 0, 0, 0, null);
    }

    public static SendResult notEligible(ChannelKind kind) {
        return new SendResult(SendOutcome.NOT_ELIGIBLE, kind, null, 0, 0, 0, 0, null);
    }

    public boolean isDelivered() {
        return outcome == SendOutcome.DELIVERED;
    }
}
