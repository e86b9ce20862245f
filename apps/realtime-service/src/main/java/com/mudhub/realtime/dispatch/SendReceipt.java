package com.mudhub.realtime.dispatch;

/**
 * 返回给发送者的回执。
 *
 * 目标不存在与被目标屏蔽使用同一个状态码和文案，发送者无法借此判断对方是否存在。
 *
 * @param retryAfterSeconds 被限流时距离窗口释放的秒数，其余为 0
 */
public record SendReceipt(String status, String message, String messageId, long retryAfterSeconds) {

    public static final String VOID_MESSAGE = "message sent into the void";

    public static final String NOT_ELIGIBLE_MESSAGE = "You are not allowed to use this channel yet";

    public static SendReceipt of(SendResult result, long nowMillis) {
        return switch (result.outcome()) {
            case DELIVERED -> new SendReceipt("SENT", "message sent", result.messageId(), 0);
            case RATE_LIMITED -> {
                long resetAt = result.rateLimit() == null ? 0 : result.rateLimit().resetTime();
                long retry = resetAt <= nowMillis ? 0 : (resetAt - nowMillis + 999) / 1000;
                yield new SendReceipt("RATE_LIMITED", "You are sending messages too quickly", null, retry);
            }
            case NO_SUCH_TARGET, MUTED -> new SendReceipt("UNDELIVERED", VOID_MESSAGE, null, 0);
            case NOT_ELIGIBLE -> new SendReceipt("NOT_ELIGIBLE", NOT_ELIGIBLE_MESSAGE, null, 0);
        };
    }
}
