package com.mudhub.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 实时消息信封：本地投递、待投递缓冲、Broker 转发共用同一结构。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeEnvelope {

    /** 消息 ID（UUID） */
    private String messageId;

    /** 进程内单调递增序号 */
    private long sequence;

    /** 消息类型 */
    private MessageKind kind;

    /** 频道（location/broadcast/direct/system） */
    private String channel;

    /** 发送者，系统消息为 null */
    private String senderId;

    /** 私聊目标 */
    private String targetId;

    /** 位置频道的位置 key */
    private String locationKey;

    /** 在线状态通知所描述的玩家 */
    private String subjectIdentity;

    /** 消息正文 */
    private String payload;

    /** 创建时间（毫秒时间戳） */
    private long timestamp;

    /** 产生该消息的实例 ID，用于丢弃 Broker 回声 */
    private String origin;

    /**
     * 判断该消息是否为“关于 identity 本人”的在线状态通知。
     */
    public boolean isPresenceAbout(String identity) {
        return kind != null && kind.isPresence()
                && subjectIdentity != null && subjectIdentity.equals(identity);
    }
}
