package com.mudhub.session.model;

/**
 * 推送给客户端的消息类型。
 */
public enum MessageKind {

    /** 聊天消息（位置/全服/私聊） */
    CHAT,

    /** 某玩家进入（上线） */
    PLAYER_ENTERED,

    /** 某玩家离开（下线） */
    PLAYER_LEFT,

    /** 系统公告 */
    SYSTEM_NOTICE,

    /** 被踢下线通知 */
    KICK;

    /** 是否为在线状态通知（需要做“不通知自己”的排除） */
    public boolean isPresence() {
        return this == PLAYER_ENTERED || this == PLAYER_LEFT;
    }
}
