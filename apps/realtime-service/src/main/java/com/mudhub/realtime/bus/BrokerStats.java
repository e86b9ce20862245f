package com.mudhub.realtime.bus;

/**
 * Broker 桥接统计。
 *
 * @param queued        等待执行的发布/订阅任务数
 * @param subscriptions 当前引用计数大于 0 的主题数
 * @param echoes        丢弃的本实例回声条数
 * @param relayed       投递到本地的入站消息条数
 */
public record BrokerStats(String client,
                          boolean degraded,
                          int queued,
                          int subscriptions,
                          long published,
                          long retries,
                          long dropped,
                          long echoes,
                          long relayed) {
}
