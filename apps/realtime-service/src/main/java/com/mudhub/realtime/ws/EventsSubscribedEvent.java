package com.mudhub.realtime.ws;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 客户端对事件队列的订阅已在 Broker 中生效。
 *
 * 在这之后推送到 /user/queue/events 的消息才能被该会话收到，因此连接登记以此事件为准。
 */
@Getter
public class EventsSubscribedEvent extends ApplicationEvent {

    private final String wsSessionId;
    private final StompPrincipal principal;

    public EventsSubscribedEvent(Object source, String wsSessionId, StompPrincipal principal) {
        super(source);
        this.wsSessionId = wsSessionId;
        this.principal = principal;
    }
}
