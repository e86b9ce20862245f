package com.mudhub.realtime;

import com.mudhub.session.ConnectionSink;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.MessageKind;
import com.mudhub.session.model.RealtimeEnvelope;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录收到的消息与关闭原因的测试 sink。
 */
public class RecordingSink implements ConnectionSink {

    public final List<RealtimeEnvelope> received = new CopyOnWriteArrayList<>();
    public volatile CloseReason closedWith;
    public volatile boolean failOnSend;

    @Override
    public void send(RealtimeEnvelope envelope) throws IOException {
        if (failOnSend) {
            throw new IOException("broken pipe");
        }
        received.add(envelope);
    }

    @Override
    public void close(CloseReason reason, String message) {
        closedWith = reason;
    }

    public List<String> chatPayloads() {
        return received.stream()
                .filter(e -> e.getKind() == MessageKind.CHAT || e.getKind() == MessageKind.SYSTEM_NOTICE)
                .map(RealtimeEnvelope::getPayload)
                .toList();
    }

    /** 关于 subject 的上下线事件，形如 "PLAYER_LEFT:alice" */
    public List<String> presenceAbout(String subject) {
        return received.stream()
                .filter(e -> e.getKind().isPresence() && subject.equals(e.getSubjectIdentity()))
                .map(e -> e.getKind() + ":" + e.getSubjectIdentity())
                .toList();
    }

    public void reset() {
        received.clear();
    }
}
