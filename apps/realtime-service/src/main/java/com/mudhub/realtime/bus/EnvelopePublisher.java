package com.mudhub.realtime.bus;

import com.mudhub.session.model.RealtimeEnvelope;

/**
 * 把已在本地投递的消息转发到 Broker。实现方必须异步执行，且不向调用方抛出 Broker 故障。
 */
@FunctionalInterface
public interface EnvelopePublisher {

    void publish(String subject, RealtimeEnvelope envelope);
}
