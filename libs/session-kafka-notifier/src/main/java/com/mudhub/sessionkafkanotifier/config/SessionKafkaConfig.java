package com.mudhub.sessionkafkanotifier.config;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * 会话失效事件 Kafka 配置。
 *
 * 配置示例（application.yml）：
 * <pre>
 * session:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: mud-session-invalidated
 *     consumer:
 *       group-id-prefix: realtime
 * </pre>
 *
 * 每个 realtime 实例都必须收到全部事件（各自断开本地连接），
 * 所以消费者组按实例区分，而不是整个集群共用一个组。
 */
@Configuration
public class SessionKafkaConfig {

    @Value("${session.kafka.bootstrap-servers}")
    private String bootstrapServers;

    /** 消费者组前缀，实际组 ID 为 {prefix}-{instanceId} */
    @Value("${session.kafka.consumer.group-id-prefix:mud-session-invalidated}")
    private String consumerGroupPrefix;

    @Value("${instance.id:${spring.application.name:realtime}}")
    private String instanceId;

    @Bean
    public ProducerFactory<String, String> sessionKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 消息内容为 fastjson2 序列化后的 JSON 字符串
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 等待所有副本确认，配合幂等生产者避免重复事件
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> sessionKafkaTemplate() {
        return new KafkaTemplate<>(sessionKafkaProducerFactory());
    }

    @Bean
    public ConsumerFactory<String, String> sessionKafkaConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroupPrefix + "-" + instanceId);
        // 手动提交 offset
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // 新实例只关心启动之后的会话变化
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        return new DefaultKafkaConsumerFactory<>(props);
    }

    /**
     * 消费者监听器容器工厂（手动提交）。
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> sessionKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(sessionKafkaConsumerFactory());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        // 同一玩家的事件按 key 分区，单消费者线程保证顺序
        factory.setConcurrency(1);
        return factory;
    }
}
