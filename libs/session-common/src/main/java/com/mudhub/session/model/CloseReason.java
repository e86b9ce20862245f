package com.mudhub.session.model;

/**
 * 连接被关闭/注销的原因。
 */
public enum CloseReason {

    /** 客户端主动关闭或传输层检测到断开 */
    CLIENT_CLOSED,

    /** 同一玩家开启了新的游戏会话，旧会话下的连接全部被踢掉 */
    SESSION_REPLACED,

    /** 长时间无活动，被清理任务回收 */
    STALE,

    /** 投递失败后被标记为不健康，由清理任务回收 */
    UNHEALTHY,

    /** 运维/鉴权侧强制下线 */
    FORCED
}
