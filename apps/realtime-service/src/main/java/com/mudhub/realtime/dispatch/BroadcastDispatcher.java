package com.mudhub.realtime.dispatch;

import com.mudhub.realtime.bus.EnvelopePublisher;
import com.mudhub.realtime.moderation.MuteDirectory;
import com.mudhub.realtime.pending.PendingMessageBuffer;
import com.mudhub.realtime.ratelimit.RateLimiter;
import com.mudhub.realtime.routing.ChannelKind;
import com.mudhub.realtime.routing.ChannelRouter;
import com.mudhub.realtime.routing.RouteResult;
import com.mudhub.session.ConnectionRegistry;
import com.mudhub.session.PresenceTransition;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.MessageKind;
import com.mudhub.session.model.RealtimeEnvelope;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 广播分发器：把一条消息投递给路由出来的全部收件人。
 *
 * 处理顺序：
 * 1. 限流；
 * 2. 路由（私聊目标不存在时直接返回）；
 * 3. 排除发送者自己（includeSelf 除外）；
 * 4. 屏蔽过滤（系统频道除外）；
 * 5. 在线则投递到每个连接，短暂离线则进入暂存缓冲，否则丢弃；
 * 6. 异步转发到 Broker。
 *
 * 上下线通知只能通过 {@link #announce(PresenceTransition)} 发出，且永远不会投递/暂存给当事人自己。
 *
 * 分发路径不获取注册表锁；投递失败只把连接标记为不健康，由清理任务回收。
 */
@Slf4j
public class BroadcastDispatcher {

    private final ConnectionRegistry registry;
    private final ChannelRouter router;
    private final RateLimiter rateLimiter;
    private final PendingMessageBuffer pending;
    private final MuteDirectory muteDirectory;
    private final EnvelopePublisher publisher;
    private final String instanceId;
    private final Clock clock;

    /** 进程内消息序号 */
    private final AtomicLong sequence = new AtomicLong();

    public BroadcastDispatcher(ConnectionRegistry registry,
                               ChannelRouter router,
                               RateLimiter rateLimiter,
                               PendingMessageBuffer pending,
                               MuteDirectory muteDirectory,
                               EnvelopePublisher publisher,
                               String instanceId,
                               Clock clock) {
        this.registry = registry;
        this.router = router;
        this.rateLimiter = rateLimiter;
        this.pending = pending;
        this.muteDirectory = muteDirectory;
        this.publisher = publisher;
        this.instanceId = instanceId;
        this.clock = clock;
    }

    /* =========================
     * 发送
     * ========================= */

    /**
     * 分发一条本地发起的消息。
     *
     * @param target      私聊目标，其他频道传 null
     * @param includeSelf 是否也投递给发送者自己（私聊回复回执、系统消息）
     */
    public SendResult dispatch(String sender, ChannelKind kind, String payload, String target, boolean includeSelf) {
        if (kind != ChannelKind.SYSTEM && (sender == null || sender.isBlank())) {
            throw new IllegalArgumentException("sender must not be blank");
        }

        if (!rateLimiter.admit(sender, kind)) {
            return SendResult.rateLimited(kind, rateLimiter.info(sender, kind));
        }

        if (!router.isEligible(sender, kind)) {
            log.debug("发送者不满足频道门槛: sender={}, channel={}", sender, kind);
            return SendResult.notEligible(kind);
        }

        RouteResult route = router.route(kind, sender, target);
        if (!route.matched()) {
            log.debug("私聊目标不存在: sender={}, target={}", sender, target);
            return SendResult.noSuchTarget(kind);
        }

        Set<String> recipients = new LinkedHashSet<>(route.recipients());
        if (sender != null) {
            recipients.remove(sender);
        }

        if (kind != ChannelKind.SYSTEM) {
            if (kind == ChannelKind.DIRECT && muteDirectory.isMuted(target, sender, kind)) {
                log.debug("私聊被屏蔽: sender={}, target={}", sender, target);
                return SendResult.muted(kind);
            }
            int before = recipients.size();
            recipients.removeIf(recipient -> muteDirectory.isMuted(recipient, sender, kind));
            if (before > 0 && recipients.isEmpty()) {
                return SendResult.muted(kind);
            }
        }

        if (kind == ChannelKind.DIRECT) {
            router.recordDirect(target, sender);
        }
        if (includeSelf && sender != null) {
            recipients.add(sender);
        }

        RealtimeEnvelope envelope = newEnvelope(kind == ChannelKind.SYSTEM ? MessageKind.SYSTEM_NOTICE : MessageKind.CHAT, kind)
                .senderId(sender)
                .targetId(kind == ChannelKind.DIRECT ? target : null)
                .locationKey(route.locationKey())
                .payload(payload)
                .build();

        DeliveryStats stats = deliverLocally(envelope, recipients);
        publishQuietly(route.subject(), envelope);

        log.debug("消息分发完成: sender={}, channel={}, seq={}, live={}, pending={}, dropped={}",
                sender, kind, envelope.getSequence(), stats.live(), stats.pending(), stats.dropped());
        return SendResult.delivered(kind, envelope.getMessageId(), envelope.getSequence(), stats);
    }

    /**
     * 回复最近一次给自己发私聊的人，回执同时投递给自己。
     */
    public SendResult reply(String sender, String payload) {
        Optional<String> target = router.replyTarget(sender);
        if (target.isEmpty()) {
            return SendResult.noSuchTarget(ChannelKind.DIRECT);
        }
        return dispatch(sender, ChannelKind.DIRECT, payload, target.get(), true);
    }

    /**
     * 系统公告：所有在线玩家，不受屏蔽影响。
     */
    public SendResult sendSystem(String payload) {
        return dispatch(null, ChannelKind.SYSTEM, payload, null, true);
    }

    /* =========================
     * 上下线通知
     * ========================= */

    /**
     * 把上下线事件通知给同一位置的玩家。当事人自己永远不在收件人之列（实时与暂存都不）。
     *
     * 只接受注册表产生的 {@link PresenceTransition}，其他路径无法调用。
     */
    public DeliveryStats announce(PresenceTransition transition) {
        String subject = transition.getIdentity();
        RouteResult route = router.routePresence(subject);
        if (route.recipients().isEmpty()) {
            return DeliveryStats.EMPTY;
        }

        Set<String> recipients = new LinkedHashSet<>(route.recipients());
        recipients.remove(subject);

        MessageKind kind = transition.isEntered() ? MessageKind.PLAYER_ENTERED : MessageKind.PLAYER_LEFT;
        RealtimeEnvelope envelope = newEnvelope(kind, ChannelKind.LOCATION)
                .subjectIdentity(subject)
                .locationKey(route.locationKey())
                .payload(subject + (transition.isEntered() ? " has entered" : " has left"))
                .build();

        DeliveryStats stats = deliverLocally(envelope, recipients);
        publishQuietly(route.subject(), envelope);

        log.info("【上下线通知】identity={}, type={}, location={}, live={}, pending={}",
                subject, transition.getType(), route.locationKey(), stats.live(), stats.pending());
        return stats;
    }

    /* =========================
     * Broker 转发进来的消息
     * ========================= */

    /**
     * 投递其他实例转发过来的消息（只投递本地连接，不再转发）。
     */
    public DeliveryStats relayInbound(ChannelKind kind, String subjectParam, RealtimeEnvelope envelope) {
        if (instanceId.equals(envelope.getOrigin())) {
            return DeliveryStats.EMPTY;
        }
        RouteResult route = router.routeInbound(kind, subjectParam, envelope.getSenderId());
        if (!route.matched()) {
            return DeliveryStats.EMPTY;
        }
        Set<String> recipients = new LinkedHashSet<>(route.recipients());
        if (envelope.getSubjectIdentity() != null) {
            recipients.remove(envelope.getSubjectIdentity());
        }
        if (kind != ChannelKind.SYSTEM && envelope.getSenderId() != null) {
            String sender = envelope.getSenderId();
            recipients.remove(sender);
            recipients.removeIf(recipient -> muteDirectory.isMuted(recipient, sender, kind));
            if (kind == ChannelKind.DIRECT && recipients.contains(subjectParam)) {
                router.recordDirect(subjectParam, sender);
            }
        }
        return deliverLocally(envelope, recipients);
    }

    /* =========================
     * 暂存消息补发
     * ========================= */

    /**
     * 新连接登记后，把该玩家的暂存消息按顺序补发到这条连接上。
     *
     * 取出即从缓冲中删除：投递中途失败时，未送达的消息直接丢弃，不再放回。
     *
     * @return 成功补发的条数
     */
    public int deliverPending(ConnectionInfo connection) {
        String identity = connection.getIdentity();
        List<RealtimeEnvelope> drained = pending.drain(identity);
        int sent = 0;
        int lost = 0;
        for (RealtimeEnvelope envelope : drained) {
            if (envelope.isPresenceAbout(identity)) {
                continue;
            }
            // 连接一旦发送失败就被标记为不健康，后续消息不再尝试
            if (lost > 0 || !sendTo(connection, envelope)) {
                lost++;
                continue;
            }
            sent++;
        }
        if (sent > 0) {
            log.info("【暂存补发】identity={}, connectionId={}, count={}", identity, connection.getConnectionId(), sent);
        }
        if (lost > 0) {
            log.warn("【暂存补发】补发失败，丢弃剩余消息: identity={}, connectionId={}, dropped={}",
                    identity, connection.getConnectionId(), lost);
        }
        return sent;
    }

    /* ============================
     * 内部工具
     * ============================ */

    private DeliveryStats deliverLocally(RealtimeEnvelope envelope, Set<String> recipients) {
        int live = 0;
        int queued = 0;
        int dropped = 0;
        for (String recipient : recipients) {
            // 上下线通知永远不发给当事人自己
            if (envelope.isPresenceAbout(recipient)) {
                continue;
            }
            List<ConnectionInfo> connections = registry.connectionsFor(recipient);
            boolean delivered = false;
            for (ConnectionInfo connection : connections) {
                delivered |= sendTo(connection, envelope);
            }
            if (delivered) {
                live++;
            } else if (!connections.isEmpty() || registry.isBrieflyReachable(recipient)) {
                pending.enqueue(recipient, envelope);
                queued++;
            } else {
                dropped++;
            }
        }
        return new DeliveryStats(live, queued, dropped);
    }

    private boolean sendTo(ConnectionInfo connection, RealtimeEnvelope envelope) {
        try {
            connection.sink().send(envelope);
            registry.touch(connection.getConnectionId());
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("消息投递失败: identity={}, connectionId={}, seq={}, error={}",
                    connection.getIdentity(), connection.getConnectionId(), envelope.getSequence(), e.getMessage());
            registry.markUnhealthy(connection.getConnectionId());
            return false;
        }
    }

    private void publishQuietly(String subject, RealtimeEnvelope envelope) {
        if (subject == null) {
            return;
        }
        try {
            publisher.publish(subject, envelope);
        } catch (RuntimeException e) {
            log.error("提交 Broker 发布任务失败: subject={}, seq={}", subject, envelope.getSequence(), e);
        }
    }

    private RealtimeEnvelope.RealtimeEnvelopeBuilder newEnvelope(MessageKind kind, ChannelKind channel) {
        return RealtimeEnvelope.builder()
                .messageId(UUID.randomUUID().toString())
                .sequence(sequence.incrementAndGet())
                .kind(kind)
                .channel(channel.channelName())
                .timestamp(clock.millis())
                .origin(instanceId);
    }
}
