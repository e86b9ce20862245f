package com.mudhub.sessionkafkanotifier.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.ComponentScan;

/**
 * 会话 Kafka 通知器自动配置。
 *
 * 配置了 session.kafka.bootstrap-servers 才启用；未配置时 realtime 服务以单机模式运行，
 * 会话切换只影响本实例。
 *
 * 扫描注册：
 * - {@link SessionKafkaConfig}
 * - {@link com.mudhub.sessionkafkanotifier.publisher.SessionEventPublisher}
 * - {@link com.mudhub.sessionkafkanotifier.listener.SessionEventConsumer}
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "session.kafka", name = "bootstrap-servers")
@ComponentScan(basePackages = "com.mudhub.sessionkafkanotifier")
public class SessionKafkaNotifierAutoConfiguration {
}
