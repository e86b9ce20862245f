package com.mudhub.realtime.ratelimit;

import com.mudhub.realtime.routing.ChannelKind;

/**
 * 某玩家在某频道上的限流状态。
 *
 * @param attempts          窗口内已放行次数
 * @param maxAttempts       窗口内允许的最大次数，0 表示不限
 * @param windowSeconds     窗口长度（秒）
 * @param attemptsRemaining 剩余次数
 * @param resetTime         最早一条记录滑出窗口的时间（毫秒时间戳），无记录时为 0
 */
public record RateLimitInfo(String identity,
                            ChannelKind kind,
                            int attempts,
                            int maxAttempts,
                            long windowSeconds,
                            int attemptsRemaining,
                            long resetTime) {
}
