package com.mudhub.realtime.gateway;

import java.util.Optional;

/**
 * 认证侧的会话权威：给出某玩家当前被认可的游戏会话。
 *
 * 返回空表示没有权威意见，此时以最新到达的会话为准。
 */
@FunctionalInterface
public interface SessionAuthority {

    Optional<String> authoritativeSession(String identity);

    /** 默认实现：不提供意见，最新会话胜出 */
    static SessionAuthority newestWins() {
        return identity -> Optional.empty();
    }
}
