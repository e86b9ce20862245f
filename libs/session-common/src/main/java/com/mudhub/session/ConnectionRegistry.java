package com.mudhub.session;

import com.mudhub.session.config.SessionRegistryProperties;
import com.mudhub.session.model.CloseReason;
import com.mudhub.session.model.ConnectionInfo;
import com.mudhub.session.model.ConnectionSnapshot;
import com.mudhub.session.model.IdentitySessionSnapshot;
import com.mudhub.session.model.PresenceStatus;
import com.mudhub.session.model.PresenceView;
import com.mudhub.session.model.TransportKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 连接与在线状态注册表（进程内）。
 *
 * 职责：
 * - 维护 identity -> 活跃连接集合、当前游戏会话；
 * - 保证同一玩家同一时刻只有一个游戏会话（新会话先踢掉旧会话的全部连接）；
 * - 作为唯一的上下线事件来源：0→1 个连接发 ENTERED，1→0 发 LEFT。
 *
 * 并发：
 * - 每个玩家一把锁（{@link IdentityEntry} 自身作为监视器），连接/断开/切换会话严格有序；
 * - 监听器回调在该锁内执行；
 * - 读操作（connectionsFor、isBrieflyReachable 等）不加锁，读取的是 volatile 快照，
 *   投递路径因此不会和注册表互相等锁。
 */
@Slf4j
public class ConnectionRegistry {

    private final ConcurrentMap<String, IdentityEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConnectionInfo> connectionsById = new ConcurrentHashMap<>();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    private final Clock clock;
    private final Duration reconnectWindow;
    private final Duration identityRetention;

    public ConnectionRegistry(SessionRegistryProperties properties, Clock clock) {
        this(properties.getReconnectWindow(), properties.getIdentityRetention(), clock);
    }

    public ConnectionRegistry(Duration reconnectWindow, Duration identityRetention, Clock clock) {
        this.reconnectWindow = Objects.requireNonNull(reconnectWindow, "reconnectWindow");
        this.identityRetention = Objects.requireNonNull(identityRetention, "identityRetention");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(RegistryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }

    /* =========================
     * 连接登记 / 注销
     * ========================= */

    /**
     * 登记一条新连接。
     *
     * - 该玩家还没有会话时，采用本次携带的 sessionId；
     * - sessionId 与当前会话不一致时拒绝（需要先调用 {@link #startNewSession}）。
     *
     * @return 新连接（connectionId 由注册表生成）
     * @throws RejectedConnectionException identity/sessionId 为空或会话不匹配
     */
    public ConnectionInfo register(String identity, TransportKind transportKind, String sessionId, ConnectionSink sink) {
        if (isBlank(identity) || isBlank(sessionId)) {
            throw new RejectedConnectionException(identity, sessionId, "identity and sessionId must not be blank");
        }
        Objects.requireNonNull(transportKind, "transportKind must not be null");
        Objects.requireNonNull(sink, "sink must not be null");

        return withEntry(identity, entry -> {
            long now = clock.millis();
            if (entry.sessionId == null) {
                entry.sessionId = sessionId;
                entry.sessionCreatedAt = now;
            } else if (!entry.sessionId.equals(sessionId)) {
                log.warn("【连接拒绝】会话不匹配: identity={}, current={}, offered={}", identity, entry.sessionId, sessionId);
                throw new RejectedConnectionException(identity, sessionId,
                        "session " + sessionId + " is not the current session of " + identity);
            }

            ConnectionInfo info = new ConnectionInfo(UUID.randomUUID().toString(), identity, transportKind,
                    sessionId, now, sink);
            boolean first = entry.connections.isEmpty();
            entry.connections.put(info.getConnectionId(), info);
            entry.publish(now);
            connectionsById.put(info.getConnectionId(), info);

            log.info("【连接登记】identity={}, connectionId={}, transport={}, session={}, total={}",
                    identity, info.getConnectionId(), transportKind, sessionId, entry.connections.size());

            fireOpened(info);
            if (first) {
                firePresence(PresenceTransition.entered(identity, sessionId, info.getConnectionId(), now));
            }
            return info;
        });
    }

    /**
     * 注销连接（传输层检测到断开时调用），幂等。
     *
     * @return 本次是否真的移除了连接
     */
    public boolean unregister(String connectionId) {
        return remove(connectionId, CloseReason.CLIENT_CLOSED, false, null);
    }

    /**
     * 主动踢出一条连接并关闭其 sink（清理任务、运维操作）。
     */
    public boolean evict(String connectionId, CloseReason reason) {
        return remove(connectionId, reason, true, "connection evicted: " + reason);
    }

    /**
     * 开启新的游戏会话。
     *
     * 在采用新会话之前，同步关闭并移除该玩家的全部旧连接。
     * 新会话与当前会话相同时不做任何事。
     *
     * @return 被踢掉的连接 ID 列表
     */
    public List<String> startNewSession(String identity, String sessionId) {
        requireText(identity, "identity");
        requireText(sessionId, "sessionId");

        return withEntry(identity, entry -> {
            if (sessionId.equals(entry.sessionId)) {
                return List.<String>of();
            }
            String previous = entry.sessionId;
            List<String> evicted = closeAll(entry, CloseReason.SESSION_REPLACED,
                    "session replaced by a newer login");
            entry.sessionId = sessionId;
            entry.sessionCreatedAt = clock.millis();
            entry.publish(entry.sessionCreatedAt);
            log.info("【会话切换】identity={}, oldSession={}, newSession={}, evicted={}",
                    identity, previous, sessionId, evicted.size());
            return evicted;
        });
    }

    /**
     * 强制下线：关闭该玩家的全部连接并结束当前会话。
     *
     * @return 被关闭的连接 ID 列表；玩家未知时返回空列表
     */
    public List<String> forceDisconnect(String identity, CloseReason reason) {
        IdentityEntry entry = entries.get(identity);
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            if (entry.retired) {
                return List.of();
            }
            List<String> closed = closeAll(entry, reason, "disconnected: " + reason);
            entry.sessionId = null;
            entry.sessionCreatedAt = null;
            entry.publish(clock.millis());
            log.info("【强制下线】identity={}, reason={}, closed={}", identity, reason, closed.size());
            return closed;
        }
    }

    /* =========================
     * 活跃度 / 健康状态
     * ========================= */

    /** 刷新连接的最近活动时间（入站帧、成功投递）。 */
    public void touch(String connectionId) {
        ConnectionInfo info = connectionId == null ? null : connectionsById.get(connectionId);
        if (info != null) {
            info.touch(clock.millis());
        }
    }

    /**
     * 标记连接不健康：投递失败时调用，连接保留到清理任务回收，
     * 投递路径不在这里做注销。
     */
    public void markUnhealthy(String connectionId) {
        ConnectionInfo info = connectionId == null ? null : connectionsById.get(connectionId);
        if (info != null && info.isHealthy()) {
            info.markUnhealthy();
            log.warn("【连接异常】标记为不健康: identity={}, connectionId={}", info.getIdentity(), connectionId);
        }
    }

    /* =========================
     * 查询
     * ========================= */

    /** 该玩家当前的健康连接（无锁快照）。 */
    public List<ConnectionInfo> connectionsFor(String identity) {
        IdentityEntry entry = identity == null ? null : entries.get(identity);
        if (entry == null) {
            return List.of();
        }
        List<ConnectionInfo> view = entry.view;
        List<ConnectionInfo> healthy = new ArrayList<>(view.size());
        for (ConnectionInfo info : view) {
            if (info.isHealthy()) {
                healthy.add(info);
            }
        }
        return healthy;
    }

    public Optional<ConnectionInfo> findConnection(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connectionsById.get(connectionId));
    }

    public PresenceView presenceOf(String identity) {
        IdentityEntry entry = identity == null ? null : entries.get(identity);
        if (entry == null) {
            return PresenceView.builder().identity(identity).status(PresenceStatus.OFFLINE).build();
        }
        int count = entry.view.size();
        return PresenceView.builder()
                .identity(identity)
                .status(count > 0 ? PresenceStatus.ONLINE : PresenceStatus.OFFLINE)
                .lastSeen(entry.lastSeen)
                .connectionCount(count)
                .build();
    }

    /**
     * 是否“短暂离线”：当前没有连接，但最近一次断开仍在重连窗口内，
     * 或者已经有会话但还没建立过连接。满足时消息进入待投递缓冲。
     */
    public boolean isBrieflyReachable(String identity) {
        IdentityEntry entry = identity == null ? null : entries.get(identity);
        if (entry == null || entry.retired || !entry.view.isEmpty()) {
            return false;
        }
        Long lastSeen = entry.lastSeen;
        if (lastSeen == null) {
            return entry.sessionId != null;
        }
        return clock.millis() - lastSeen <= reconnectWindow.toMillis();
    }

    /** 注册表是否认识该玩家（在线，或者离线但条目尚未被回收）。 */
    public boolean isKnown(String identity) {
        IdentityEntry entry = identity == null ? null : entries.get(identity);
        return entry != null && !entry.retired;
    }

    public Set<String> onlineIdentities() {
        Set<String> online = new LinkedHashSet<>();
        entries.forEach((identity, entry) -> {
            if (!entry.view.isEmpty()) {
                online.add(identity);
            }
        });
        return online;
    }

    public Optional<String> currentSession(String identity) {
        IdentityEntry entry = identity == null ? null : entries.get(identity);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.sessionId);
    }

    /** 获取玩家的会话聚合快照。 */
    public IdentitySessionSnapshot snapshot(String identity) {
        long now = clock.millis();
        IdentityEntry entry = identity == null ? null : entries.get(identity);
        List<ConnectionSnapshot> connections = new ArrayList<>();
        if (entry != null) {
            for (ConnectionInfo info : entry.view) {
                connections.add(ConnectionSnapshot.of(info, now));
            }
        }
        return IdentitySessionSnapshot.builder()
                .identity(identity)
                .sessionId(entry == null ? null : entry.sessionId)
                .sessionCreatedAt(entry == null ? null : entry.sessionCreatedAt)
                .presence(presenceOf(identity))
                .connections(connections)
                .build();
    }

    /** 当前全部连接（包括不健康的），供清理任务遍历。 */
    public Collection<ConnectionInfo> allConnections() {
        return List.copyOf(connectionsById.values());
    }

    public int connectionCount() {
        return connectionsById.size();
    }

    public int identityCount() {
        return entries.size();
    }

    /* =========================
     * 回收
     * ========================= */

    /**
     * 回收长时间无连接的玩家条目（超过 identityRetention）。
     *
     * @return 被回收的玩家标识
     */
    public List<String> pruneIdleIdentities() {
        long now = clock.millis();
        long retention = identityRetention.toMillis();
        List<String> pruned = new ArrayList<>();
        for (Map.Entry<String, IdentityEntry> e : entries.entrySet()) {
            IdentityEntry entry = e.getValue();
            synchronized (entry) {
                if (entry.retired || !entry.connections.isEmpty()) {
                    continue;
                }
                if (now - entry.lastTouched > retention) {
                    entry.retired = true;
                    entries.remove(e.getKey(), entry);
                    pruned.add(e.getKey());
                }
            }
        }
        if (!pruned.isEmpty()) {
            log.debug("回收空闲玩家条目: count={}", pruned.size());
        }
        return pruned;
    }

    /* ============================
     * 内部工具
     * ============================ */

    /**
     * 在玩家锁内执行操作。条目可能恰好被回收（retired），此时重新获取。
     */
    private <T> T withEntry(String identity, Function<IdentityEntry, T> action) {
        while (true) {
            IdentityEntry entry = entries.computeIfAbsent(identity, IdentityEntry::new);
            synchronized (entry) {
                if (entry.retired) {
                    continue;
                }
                return action.apply(entry);
            }
        }
    }

    private boolean remove(String connectionId, CloseReason reason, boolean closeSink, String message) {
        if (connectionId == null) {
            return false;
        }
        ConnectionInfo known = connectionsById.get(connectionId);
        if (known == null) {
            return false;
        }
        IdentityEntry entry = entries.get(known.getIdentity());
        if (entry == null) {
            log.error("连接所属玩家条目不存在: identity={}, connectionId={}", known.getIdentity(), connectionId);
            connectionsById.remove(connectionId, known);
            return false;
        }
        synchronized (entry) {
            ConnectionInfo removed = entry.connections.remove(connectionId);
            if (removed == null) {
                return false;
            }
            detach(entry, removed, reason);
            if (closeSink) {
                removed.sink().close(reason, message);
            }
            return true;
        }
    }

    /** 调用方必须持有 entry 锁。 */
    private List<String> closeAll(IdentityEntry entry, CloseReason reason, String message) {
        if (entry.connections.isEmpty()) {
            return List.of();
        }
        List<ConnectionInfo> victims = new ArrayList<>(entry.connections.values());
        List<String> ids = new ArrayList<>(victims.size());
        for (ConnectionInfo victim : victims) {
            entry.connections.remove(victim.getConnectionId());
            detach(entry, victim, reason);
            victim.sink().close(reason, message);
            ids.add(victim.getConnectionId());
        }
        return ids;
    }

    /** 调用方必须持有 entry 锁，且 removed 已从 entry.connections 中移除。 */
    private void detach(IdentityEntry entry, ConnectionInfo removed, CloseReason reason) {
        long now = clock.millis();
        connectionsById.remove(removed.getConnectionId(), removed);
        boolean last = entry.connections.isEmpty();
        if (last) {
            entry.lastSeen = now;
        }
        entry.publish(now);

        log.info("【连接移除】identity={}, connectionId={}, reason={}, remaining={}",
                entry.identity, removed.getConnectionId(), reason, entry.connections.size());

        fireClosed(removed, reason);
        if (last) {
            firePresence(PresenceTransition.left(entry.identity, removed.getSessionId(), removed.getConnectionId(), now));
        }
    }

    private void fireOpened(ConnectionInfo info) {
        for (RegistryListener listener : listeners) {
            try {
                listener.onConnectionOpened(info);
            } catch (RuntimeException e) {
                log.error("监听器处理连接登记失败: listener={}, connectionId={}",
                        listener.getClass().getSimpleName(), info.getConnectionId(), e);
            }
        }
    }

    private void fireClosed(ConnectionInfo info, CloseReason reason) {
        for (RegistryListener listener : listeners) {
            try {
                listener.onConnectionClosed(info, reason);
            } catch (RuntimeException e) {
                log.error("监听器处理连接移除失败: listener={}, connectionId={}",
                        listener.getClass().getSimpleName(), info.getConnectionId(), e);
            }
        }
    }

    private void firePresence(PresenceTransition transition) {
        for (RegistryListener listener : listeners) {
            try {
                listener.onPresenceChanged(transition);
            } catch (RuntimeException e) {
                log.error("监听器处理上下线事件失败: listener={}, transition={}",
                        listener.getClass().getSimpleName(), transition, e);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** 参数校验：字符串必须有值。 */
    private static void requireText(String value, String fieldName) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
    }

    /**
     * 单个玩家的注册表条目。写操作在条目锁内进行，
     * 写完后通过 {@link #publish} 刷新 volatile 快照供无锁读取。
     */
    private static final class IdentityEntry {

        final String identity;
        final Map<String, ConnectionInfo> connections = new LinkedHashMap<>();

        volatile List<ConnectionInfo> view = List.of();
        volatile String sessionId;
        volatile Long sessionCreatedAt;
        volatile Long lastSeen;
        volatile boolean retired;
        long lastTouched;

        IdentityEntry(String identity) {
            this.identity = identity;
        }

        void publish(long now) {
            view = List.copyOf(connections.values());
            lastTouched = now;
        }
    }
}
