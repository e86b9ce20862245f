package com.mudhub.realtime.sse;

import com.mudhub.realtime.config.RealtimeProperties;
import com.mudhub.realtime.gateway.RealtimeGateway;
import com.mudhub.session.RejectedConnectionException;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.TransportKind;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * SSE 流管理：建流时经网关登记连接，流结束（完成/超时/出错）时注销；
 * 定时发送心跳，发送失败的流立即注销。
 */
@Slf4j
@Component
public class SseStreamManager {

    private final RealtimeGateway gateway;
    private final RealtimeProperties.Sse config;
    private final ScheduledExecutorService scheduler;

    /** connectionId -> 流 */
    private final Map<String, SseConnectionSink> streams = new ConcurrentHashMap<>();

    private ScheduledFuture<?> heartbeatTask;

    public SseStreamManager(RealtimeGateway gateway,
                            RealtimeProperties properties,
                            @Qualifier("janitorScheduler") ScheduledExecutorService scheduler) {
        this.gateway = gateway;
        this.config = properties.getSse();
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void start() {
        long period = config.getHeartbeatInterval().toMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(this::heartbeat, period, period, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void stop() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
        }
    }

    /**
     * 打开一条事件流。
     *
     * @throws RejectedConnectionException 会话被拒绝（映射为 HTTP 409）
     */
    public SseEmitter open(String identity, String gameSession) {
        SseEmitter emitter = new SseEmitter(config.getTimeout().toMillis());
        SseConnectionSink sink = new SseConnectionSink(emitter);

        ConnectionInfo connection = gateway.acceptConnection(identity, TransportKind.SERVER_PUSH_STREAM, gameSession, sink);
        String connectionId = connection.getConnectionId();
        streams.put(connectionId, sink);
        emitter.onCompletion(() -> closeStream(connectionId));
        emitter.onTimeout(() -> closeStream(connectionId));
        emitter.onError(e -> closeStream(connectionId));
        log.info("【SSE】连接登记: identity={}, connectionId={}", identity, connectionId);
        return emitter;
    }

    void heartbeat() {
        streams.forEach((connectionId, sink) -> {
            try {
                sink.heartbeat();
                gateway.touch(connectionId);
            } catch (IOException | IllegalStateException e) {
                log.debug("【SSE】心跳失败，注销连接: connectionId={}, error={}", connectionId, e.getMessage());
                closeStream(connectionId);
            }
        });
    }

    private void closeStream(String connectionId) {
        if (streams.remove(connectionId) != null) {
            gateway.onConnectionClosed(connectionId);
            log.info("【SSE】连接断开: connectionId={}", connectionId);
        }
    }

    public int streamCount() {
        return streams.size();
    }
}
