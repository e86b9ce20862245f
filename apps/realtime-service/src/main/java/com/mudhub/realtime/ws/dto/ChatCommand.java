package com.mudhub.realtime.ws.dto;

import lombok.Data;

/**
 * 客户端发送聊天消息（/app/chat.send）。
 */
@Data
public class ChatCommand {
    /** 频道：location / broadcast / direct */
    private String channel;
    /** 私聊目标，其他频道为空 */
    private String target;
    private String content;
}
