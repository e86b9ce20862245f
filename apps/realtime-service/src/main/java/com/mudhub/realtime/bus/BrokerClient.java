package com.mudhub.realtime.bus;

/**
 * 外部消息 Broker 的最小抽象：按主题发布/订阅字符串消息。
 */
public interface BrokerClient {

    /**
     * @throws BrokerUnavailableException Broker 连接失败
     */
    void publish(String subject, String message);

    /**
     * 订阅主题。同一主题可以被多个 handler 订阅。
     *
     * @throws BrokerUnavailableException Broker 连接失败
     */
    Subscription subscribe(String subject, MessageHandler handler);

    /** 实现名称，用于日志与统计 */
    String name();

    @FunctionalInterface
    interface MessageHandler {
        void onMessage(String subject, String body);
    }

    /**
     * 订阅句柄。
     */
    interface Subscription {

        String subject();

        /** 取消订阅，重复调用无副作用 */
        void cancel();
    }
}
