package com.mudhub.realtime.config;

import com.mudhub.realtime.bus.BrokerBridge;
import com.mudhub.realtime.bus.BrokerClient;
import com.mudhub.realtime.bus.InMemoryBrokerClient;
import com.mudhub.realtime.bus.LocationMembershipSync;
import com.mudhub.realtime.bus.LocationSubscriptionTracker;
import com.mudhub.realtime.bus.SubjectNames;
import com.mudhub.realtime.dispatch.BroadcastDispatcher;
import com.mudhub.realtime.dispatch.PresenceNotifier;
import com.mudhub.realtime.gateway.RealtimeGateway;
import com.mudhub.realtime.gateway.SessionAuthority;
import com.mudhub.realtime.janitor.ConnectionJanitor;
import com.mudhub.realtime.janitor.MemoryProbe;
import com.mudhub.realtime.moderation.InMemoryMuteDirectory;
import com.mudhub.realtime.pending.PendingMessageBuffer;
import com.mudhub.realtime.ratelimit.RateLimiter;
import com.mudhub.realtime.routing.ChannelRouter;
import com.mudhub.realtime.routing.InMemoryWorldDirectory;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.sessionkafkanotifier.publisher.SessionEventPublisher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 实时通信核心组件装配。
 *
 * 注册表监听器：Broker 桥（私聊主题）、位置同步（位置主题）、上下线通知（分发器）。
 */
@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class RealtimeConfig {

    /* =========================
     * Broker
     * ========================= */

    @Bean
    public SubjectNames subjectNames(RealtimeProperties properties) {
        return new SubjectNames(properties.getBroker().getSubjectRoot());
    }

    @Bean
    @ConditionalOnProperty(prefix = "realtime.broker", name = "type", havingValue = "in-memory")
    public BrokerClient inMemoryBrokerClient() {
        return new InMemoryBrokerClient();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public BrokerBridge brokerBridge(BrokerClient brokerClient,
                                     SubjectNames subjectNames,
                                     RealtimeProperties properties,
                                     ConnectionRegistry registry) {
        BrokerBridge bridge = new BrokerBridge(brokerClient, subjectNames, properties.getInstanceId(), properties.getBroker());
        registry.addListener(bridge);
        return bridge;
    }

    /* =========================
     * 世界 / 屏蔽 / 路由
     * ========================= */

    @Bean
    public InMemoryWorldDirectory worldDirectory() {
        return new InMemoryWorldDirectory();
    }

    @Bean
    public InMemoryMuteDirectory muteDirectory() {
        return new InMemoryMuteDirectory();
    }

    @Bean
    public ChannelRouter channelRouter(ConnectionRegistry registry,
                                       InMemoryWorldDirectory worldDirectory,
                                       SubjectNames subjectNames) {
        return new ChannelRouter(registry, worldDirectory, subjectNames);
    }

    @Bean
    public LocationSubscriptionTracker locationSubscriptionTracker(BrokerBridge brokerBridge, SubjectNames subjectNames) {
        return new LocationSubscriptionTracker(brokerBridge, subjectNames);
    }

    @Bean
    public LocationMembershipSync locationMembershipSync(InMemoryWorldDirectory worldDirectory,
                                                         LocationSubscriptionTracker tracker,
                                                         ConnectionRegistry registry) {
        LocationMembershipSync sync = new LocationMembershipSync(worldDirectory, tracker, registry);
        registry.addListener(sync);
        return sync;
    }

    /* =========================
     * 限流 / 暂存 / 分发
     * ========================= */

    @Bean
    public RateLimiter rateLimiter(RealtimeProperties properties, Clock clock) {
        return new RateLimiter(properties.getRateLimit(), clock);
    }

    @Bean
    public PendingMessageBuffer pendingMessageBuffer(RealtimeProperties properties, Clock clock) {
        return new PendingMessageBuffer(properties.getPending(), clock);
    }

    @Bean
    public BroadcastDispatcher broadcastDispatcher(ConnectionRegistry registry,
                                                   ChannelRouter channelRouter,
                                                   RateLimiter rateLimiter,
                                                   PendingMessageBuffer pendingMessageBuffer,
                                                   InMemoryMuteDirectory muteDirectory,
                                                   BrokerBridge brokerBridge,
                                                   RealtimeProperties properties,
                                                   Clock clock) {
        BroadcastDispatcher dispatcher = new BroadcastDispatcher(registry, channelRouter, rateLimiter,
                pendingMessageBuffer, muteDirectory, brokerBridge, properties.getInstanceId(), clock);
        brokerBridge.setInboundHandler(dispatcher::relayInbound);
        registry.addListener(new PresenceNotifier(dispatcher));
        return dispatcher;
    }

    /* =========================
     * 网关
     * ========================= */

    @Bean
    @ConditionalOnMissingBean
    public SessionAuthority sessionAuthority() {
        return SessionAuthority.newestWins();
    }

    @Bean
    public RealtimeGateway realtimeGateway(ConnectionRegistry registry,
                                           BroadcastDispatcher broadcastDispatcher,
                                           SessionAuthority sessionAuthority,
                                           ObjectProvider<SessionEventPublisher> sessionEventPublisher,
                                           RealtimeProperties properties) {
        return new RealtimeGateway(registry, broadcastDispatcher, sessionAuthority, sessionEventPublisher, properties);
    }

    /* =========================
     * 清理
     * ========================= */

    @Bean
    @ConditionalOnMissingBean
    public MemoryProbe memoryProbe() {
        return MemoryProbe.runtime();
    }

    @Bean(destroyMethod = "stop")
    public ConnectionJanitor connectionJanitor(ConnectionRegistry registry,
                                               PendingMessageBuffer pendingMessageBuffer,
                                               RateLimiter rateLimiter,
                                               ChannelRouter channelRouter,
                                               LocationMembershipSync locationMembershipSync,
                                               RealtimeProperties properties,
                                               MemoryProbe memoryProbe,
                                               Clock clock,
                                               @Qualifier("janitorScheduler") ScheduledThreadPoolExecutor janitorScheduler) {
        ConnectionJanitor janitor = new ConnectionJanitor(registry, pendingMessageBuffer, rateLimiter, channelRouter,
                locationMembershipSync, properties.getJanitor(), memoryProbe, clock);
        janitor.start(janitorScheduler);
        return janitor;
    }
}
