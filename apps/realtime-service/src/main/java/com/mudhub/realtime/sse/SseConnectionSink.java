package com.mudhub.realtime.sse;

import com.mudhub.session.ConnectionSink;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.MessageKind;
import com.mudhub.session.model.RealtimeEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;

/**
 * 一条 SSE 流上的事件出口。事件名为消息类型，事件 ID 为消息序号。
 */
@Slf4j
public class SseConnectionSink implements ConnectionSink {

    private final SseEmitter emitter;

    public SseConnectionSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(RealtimeEnvelope envelope) throws IOException {
        emitter.send(SseEmitter.event()
                .id(String.valueOf(envelope.getSequence()))
                .name(envelope.getKind().name())
                .data(envelope, MediaType.APPLICATION_JSON));
    }

    /** 心跳注释（客户端忽略），失败说明流已断开 */
    public void heartbeat() throws IOException {
        emitter.send(SseEmitter.event().comment("ping"));
    }

    @Override
    public void close(CloseReason reason, String message) {
        try {
            emitter.send(SseEmitter.event()
                    .name(MessageKind.KICK.name())
                    .data(Map.of("reason", reason.name(), "message", message == null ? "" : message),
                            MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE 踢下线通知发送失败: reason={}, error={}", reason, e.getMessage());
        }
        emitter.complete();
    }
}
