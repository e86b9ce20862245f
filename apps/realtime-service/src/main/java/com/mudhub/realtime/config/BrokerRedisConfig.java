package com.mudhub.realtime.config;

import com.mudhub.realtime.bus.BrokerClient;
import com.mudhub.realtime.bus.RedisBrokerClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Broker 专用的 Redis 配置（Pub/Sub）。
 *
 * 与业务缓存使用独立的连接工厂，连接参数取自 realtime.broker.redis.*。
 */
@Configuration
@ConditionalOnProperty(prefix = "realtime.broker", name = "type", havingValue = "redis", matchIfMissing = true)
public class BrokerRedisConfig {

    public static final String BROKER_REDIS_FACTORY_BEAN = "brokerRedisConnectionFactory";

    /**
     * @param host     Redis 主机
     * @param port     Redis 端口
     * @param database Redis 库编号（Pub/Sub 与库无关，只影响连接）
     * @param password Redis 密码（可为空）
     */
    @Bean(name = BROKER_REDIS_FACTORY_BEAN)
    public LettuceConnectionFactory brokerRedisConnectionFactory(
            @Value("${realtime.broker.redis.host:localhost}") String host,
            @Value("${realtime.broker.redis.port:6379}") int port,
            @Value("${realtime.broker.redis.database:0}") int database,
            @Value("${realtime.broker.redis.password:}") String password) {

        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(host, port);
        if (password != null && !password.isEmpty()) {
            configuration.setPassword(password);
        }
        configuration.setDatabase(database);
        return new LettuceConnectionFactory(configuration);
    }

    @Bean
    public StringRedisTemplate brokerRedisTemplate(
            @Qualifier(BROKER_REDIS_FACTORY_BEAN) LettuceConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }

    @Bean
    public RedisMessageListenerContainer brokerListenerContainer(
            @Qualifier(BROKER_REDIS_FACTORY_BEAN) LettuceConnectionFactory factory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(factory);
        return container;
    }

    @Bean
    public BrokerClient redisBrokerClient(StringRedisTemplate brokerRedisTemplate,
                                          RedisMessageListenerContainer brokerListenerContainer) {
        return new RedisBrokerClient(brokerRedisTemplate, brokerListenerContainer);
    }
}
