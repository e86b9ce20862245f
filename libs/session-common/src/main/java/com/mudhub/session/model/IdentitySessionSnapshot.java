package com.mudhub.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 玩家会话快照：当前游戏会话 + 该会话下的全部连接 + 在线状态。
 *
 * 用于后台展示与“强制下线”前的核对。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentitySessionSnapshot {

    /** 玩家标识 */
    private String identity;

    /** 当前游戏会话 ID（可能为 null） */
    private String sessionId;

    /** 会话创建时间（毫秒时间戳） */
    private Long sessionCreatedAt;

    /** 在线状态 */
    private PresenceView presence;

    /** 连接列表 */
    @Builder.Default
    private List<ConnectionSnapshot> connections = new ArrayList<>();

    /** 按传输类型统计的连接数 */
    public long countByTransport(TransportKind kind) {
        return connections.stream().filter(c -> c.getTransportKind() == kind).count();
    }
}
