package com.mudhub.realtime.sse;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * 单向事件流入口，供不能使用 WebSocket 的客户端接收聊天与上下线事件。
 * 身份由上游网关透传在请求头中。
 */
@RestController
@RequestMapping("/sse")
@RequiredArgsConstructor
public class SseController {

    public static final String IDENTITY_HEADER = "X-Identity";
    public static final String GAME_SESSION_HEADER = "X-Game-Session";

    private final SseStreamManager streamManager;

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestHeader(IDENTITY_HEADER) String identity,
                             @RequestHeader(GAME_SESSION_HEADER) String gameSession) {
        return streamManager.open(identity.strip(), gameSession.strip());
    }
}
