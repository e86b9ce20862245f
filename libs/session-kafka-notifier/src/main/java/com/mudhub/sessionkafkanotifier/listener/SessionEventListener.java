package com.mudhub.sessionkafkanotifier.listener;

import com.mudhub.session.event.SessionInvalidatedEvent;

/**
 * 会话事件监听器接口。
 *
 * 实现方处理其他实例发出的会话失效事件（例如断开本地连接）。
 * 抛出异常表示处理失败，消息不会被提交，稍后重新消费。
 */
public interface SessionEventListener {

    void onSessionInvalidated(SessionInvalidatedEvent event);
}
