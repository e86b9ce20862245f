package com.mudhub.realtime.ws;

import com.mudhub.realtime.dispatch.SendReceipt;
import com.mudhub.realtime.dispatch.SendResult;
import com.mudhub.realtime.gateway.RealtimeGateway;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.realtime.ws.dto.ChatCommand;
import com.mudhub.realtime.ws.dto.ReplyCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Clock;

/**
 * STOMP 聊天入口。发送结果以回执形式返回到发送者当前会话的 /user/queue/receipts。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ChatWsController {

    private static final String RECEIPTS = "/queue/receipts";

    private final RealtimeGateway gateway;
    private final WebSocketSessionManager sessionManager;
    private final Clock clock;

    /**
     * 发送聊天：/app/chat.send
     */
    @MessageMapping("/chat.send")
    @SendToUser(destinations = RECEIPTS, broadcast = false)
    public SendReceipt send(@Payload ChatCommand cmd, SimpMessageHeaderAccessor sha) {
        String identity = requireIdentity(sha);
        sessionManager.touch(sha.getSessionId());
        ChannelKind kind = ChannelKind.fromChannelName(cmd.getChannel());
        SendResult result = gateway.send(identity, kind, cmd.getContent(), cmd.getTarget());
        return SendReceipt.of(result, clock.millis());
    }

    /**
     * 回复私聊：/app/chat.reply
     */
    @MessageMapping("/chat.reply")
    @SendToUser(destinations = RECEIPTS, broadcast = false)
    public SendReceipt reply(@Payload ReplyCommand cmd, SimpMessageHeaderAccessor sha) {
        String identity = requireIdentity(sha);
        sessionManager.touch(sha.getSessionId());
        SendResult result = gateway.reply(identity, cmd.getContent());
        return SendReceipt.of(result, clock.millis());
    }

    /**
     * 客户端保活：/app/ping，只刷新连接活动时间。
     */
    @MessageMapping("/ping")
    public void ping(SimpMessageHeaderAccessor sha) {
        sessionManager.touch(sha.getSessionId());
    }

    @MessageExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    @SendToUser(destinations = RECEIPTS, broadcast = false)
    public SendReceipt handleRejected(RuntimeException e) {
        log.debug("【WS】消息被拒绝: {}", e.getMessage());
        return new SendReceipt("REJECTED", e.getMessage(), null, 0);
    }

    private String requireIdentity(SimpMessageHeaderAccessor sha) {
        Principal user = sha.getUser();
        if (user == null) {
            throw new IllegalStateException("unauthenticated session");
        }
        return user.getName();
    }
}
