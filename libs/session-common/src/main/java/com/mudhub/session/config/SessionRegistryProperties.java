package com.mudhub.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 连接注册表配置（前缀 session.registry）。
 */
@Data
@ConfigurationProperties(prefix = "session.registry")
public class SessionRegistryProperties {

    /** 是否启用注册表自动配置 */
    private boolean enabled = true;

    /** 重连窗口：最后一个连接断开后，这段时间内的消息进入待投递缓冲 */
    private Duration reconnectWindow = Duration.ofSeconds(60);

    /** 无连接的玩家条目保留时长，超过后由清理任务回收 */
    private Duration identityRetention = Duration.ofHours(1);
}
