package com.mudhub.realtime.bus;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;

/**
 * 基于 Redis Pub/Sub 的 Broker 实现。
 *
 * 主题直接作为 Redis channel 名；订阅由 {@link RedisMessageListenerContainer} 统一管理，
 * 回调在容器的监听线程上执行。
 */
@Slf4j
public class RedisBrokerClient implements BrokerClient {

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;

    public RedisBrokerClient(StringRedisTemplate redis, RedisMessageListenerContainer container) {
        this.redis = redis;
        this.container = container;
    }

    @Override
    public void publish(String subject, String message) {
        try {
            redis.convertAndSend(subject, message);
        } catch (DataAccessException e) {
            throw new BrokerUnavailableException("redis publish failed: " + subject, e);
        }
    }

    @Override
    public Subscription subscribe(String subject, MessageHandler handler) {
        ChannelTopic topic = new ChannelTopic(subject);
        MessageListener listener = (Message message, byte[] pattern) -> handler.onMessage(
                new String(message.getChannel(), StandardCharsets.UTF_8),
                new String(message.getBody(), StandardCharsets.UTF_8));
        try {
            container.addMessageListener(listener, topic);
        } catch (DataAccessException e) {
            throw new BrokerUnavailableException("redis subscribe failed: " + subject, e);
        }
        log.debug("Redis 订阅: channel={}", subject);
        return new Subscription() {
            @Override
            public String subject() {
                return subject;
            }

            @Override
            public void cancel() {
                try {
                    container.removeMessageListener(listener, topic);
                    log.debug("Redis 取消订阅: channel={}", subject);
                } catch (DataAccessException e) {
                    log.warn("Redis 取消订阅失败: channel={}, error={}", subject, e.getMessage());
                }
            }
        };
    }

    @Override
    public String name() {
        return "redis";
    }
}
