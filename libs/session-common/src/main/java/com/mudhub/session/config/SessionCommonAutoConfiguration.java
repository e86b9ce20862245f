package com.mudhub.session.config;

import com.mudhub.session.ConnectionRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * 会话/连接注册表自动配置入口。
 *
 * - 开关：session.registry.enabled（默认开启）
 * - 提供 {@link ConnectionRegistry} 与系统时钟，业务方可自行声明同类型 Bean 覆盖
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "session.registry", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SessionRegistryProperties.class)
public class SessionCommonAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionRegistry connectionRegistry(SessionRegistryProperties properties, Clock clock) {
        return new ConnectionRegistry(properties, clock);
    }
}
