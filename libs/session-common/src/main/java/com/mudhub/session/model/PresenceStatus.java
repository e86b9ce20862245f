package com.mudhub.session.model;

/**
 * 在线状态（派生值，不单独存储）：至少一个连接即为 ONLINE。
 */
public enum PresenceStatus {
    ONLINE,
    OFFLINE
}
