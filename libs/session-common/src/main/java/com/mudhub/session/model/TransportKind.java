package com.mudhub.session.model;

/**
 * 连接的传输类型。
 *
 * 同一玩家可以同时持有两种连接，两条投递路径互不替代。
 */
public enum TransportKind {

    /** 双向长连接（STOMP over WebSocket） */
    BIDIRECTIONAL_SOCKET,

    /** 服务端单向推送流（SSE） */
    SERVER_PUSH_STREAM
}
