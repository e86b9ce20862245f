package com.mudhub.realtime.ws.dto;

import lombok.Data;

/**
 * 回复最近一次私聊自己的玩家（/app/chat.reply）。
 */
@Data
public class ReplyCommand {
    private String content;
}
