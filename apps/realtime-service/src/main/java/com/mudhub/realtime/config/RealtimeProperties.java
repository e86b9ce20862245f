package com.mudhub.realtime.config;

import com.mudhub.realtime.routing.ChannelKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * realtime 服务配置（前缀 realtime）。
 */
@Data
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    /** 实例 ID：写入消息信封的 origin，用来丢弃 Broker 回声 */
    private String instanceId = "realtime-local";

    /** 单条聊天消息最大长度 */
    private int maxMessageLength = 500;

    private RateLimit rateLimit = new RateLimit();

    private Pending pending = new Pending();

    private Broker broker = new Broker();

    private Janitor janitor = new Janitor();

    private Sse sse = new Sse();

    @Data
    public static class RateLimit {

        /** 滑动窗口长度 */
        private Duration window = Duration.ofSeconds(60);

        /** 每个频道在窗口内允许的发送次数，0 表示不限 */
        private Map<ChannelKind, Integer> limits = defaultLimits();

        private static Map<ChannelKind, Integer> defaultLimits() {
            Map<ChannelKind, Integer> limits = new EnumMap<>(ChannelKind.class);
            limits.put(ChannelKind.LOCATION, 20);
            limits.put(ChannelKind.BROADCAST, 10);
            limits.put(ChannelKind.DIRECT, 30);
            limits.put(ChannelKind.SYSTEM, 0);
            return limits;
        }
    }

    @Data
    public static class Pending {

        /** 每个玩家最多暂存的消息数，超出时丢弃最早的 */
        private int maxPerIdentity = 100;

        /** 暂存消息的存活时间 */
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class Broker {

        /** redis | in-memory */
        private String type = "redis";

        /** 主题根前缀 */
        private String subjectRoot = "chat";

        /** 发布队列容量，满了丢弃并记录 */
        private int queueCapacity = 10_000;

        /** 发布失败后的首次重试间隔 */
        private Duration retryInitialDelay = Duration.ofMillis(200);

        /** 重试间隔上限 */
        private Duration retryMaxDelay = Duration.ofSeconds(10);
    }

    @Data
    public static class Janitor {

        /** 检查周期 */
        private Duration checkInterval = Duration.ofSeconds(30);

        /** 常规清理间隔 */
        private Duration cleanupInterval = Duration.ofMinutes(5);

        /** 堆内存使用率超过该阈值时立即清理 */
        private double memoryThreshold = 0.8;

        /** 连接最大存活时间（同时需满足空闲条件才会被回收） */
        private Duration maxConnectionAge = Duration.ofMinutes(5);

        /** 连接最大空闲时间 */
        private Duration maxIdle = Duration.ofMinutes(5);

        /** 每个玩家暂存消息上限（清理时裁剪） */
        private int maxPendingMessages = 1000;

        /** 每个限流桶保留的历史记录上限 */
        private int maxRateLimitEntries = 1000;
    }

    @Data
    public static class Sse {

        /** 单条 SSE 流的最长保持时间，到期后客户端自动重连 */
        private Duration timeout = Duration.ofMinutes(30);

        /** 心跳注释的发送间隔，发送失败即认为流已断开 */
        private Duration heartbeatInterval = Duration.ofSeconds(15);
    }
}
