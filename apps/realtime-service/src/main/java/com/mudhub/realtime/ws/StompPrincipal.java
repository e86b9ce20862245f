package com.mudhub.realtime.ws;

import java.security.Principal;

/**
 * STOMP 连接的主体：玩家标识 + 建连时携带的游戏会话 ID。
 */
public record StompPrincipal(String identity, String gameSession) implements Principal {

    @Override
    public String getName() {
        return identity;
    }
}
