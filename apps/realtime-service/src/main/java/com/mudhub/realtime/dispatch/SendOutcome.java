package com.mudhub.realtime.dispatch;

/**
 * 发送结果类型。限流、目标不存在、被屏蔽、不满足频道门槛都是正常结果，不抛异常。
 */
public enum SendOutcome {
    DELIVERED,
    RATE_LIMITED,
    NO_SUCH_TARGET,
    MUTED,
    NOT_ELIGIBLE
}
